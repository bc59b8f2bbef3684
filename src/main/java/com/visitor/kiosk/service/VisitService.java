package com.visitor.kiosk.service;

import com.visitor.kiosk.conversation.CheckinField;
import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.entity.VisitLog;
import com.visitor.kiosk.entity.Visitor;
import com.visitor.kiosk.repository.HostRepository;
import com.visitor.kiosk.repository.VisitLogRepository;
import com.visitor.kiosk.repository.VisitorRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns collected check-in answers into visitor, host and visit rows, and
 * moves visits through their lifecycle afterwards.
 */
@Service
@RequiredArgsConstructor
public class VisitService {

    private static final Logger log = LoggerFactory.getLogger(VisitService.class);

    private final VisitorRepository visitorRepository;
    private final HostRepository hostRepository;
    private final VisitLogRepository visitLogRepository;
    private final FieldValidationService fieldValidationService;
    private final CheckinInterviewService interviewService;
    private final HostRegistrationService hostRegistrationService;

    // =========================================================
    // FINALIZE
    // =========================================================

    /**
     * Get-or-create the visitor by (full_name, email) and the host by email,
     * then record a new checked-in visit.
     *
     * @throws IllegalArgumentException when full_name or host_email is blank
     */
    @Transactional
    public VisitLog finalizeCheckin(Map<String, ?> payload) {
        String fullName = text(payload, CheckinField.FULL_NAME);
        String email = text(payload, CheckinField.EMAIL);
        String phone = text(payload, CheckinField.PHONE);
        String idNumber = text(payload, CheckinField.ID_NUMBER);
        String hostEmail = text(payload, CheckinField.HOST_EMAIL);
        String purpose = text(payload, CheckinField.PURPOSE);

        if (fullName == null || hostEmail == null) {
            throw new IllegalArgumentException("Missing required check-in fields.");
        }

        List<CheckinField> unanswered = interviewService.missingFields(asStringMap(payload));
        if (!unanswered.isEmpty()) {
            log.info("Finalizing check-in for {} with unanswered fields {}", fullName, unanswered);
        }
        warnIfInvalid(CheckinField.EMAIL, email);
        warnIfInvalid(CheckinField.PHONE, phone);
        warnIfInvalid(CheckinField.ID_NUMBER, idNumber);

        Visitor visitor = getOrCreateVisitor(fullName, email, phone, idNumber);
        Host host = getOrCreateHost(hostEmail);

        VisitLog visit = VisitLog.builder()
                .visitor(visitor)
                .host(host)
                .purpose(purpose)
                .status(VisitLog.Status.CHECKED_IN)
                .build();
        visit = visitLogRepository.save(visit);

        log.info("Checked in visitor={} (id={}) host={} visitLog={}",
                visitor.getFullName(), visitor.getId(), host.getEmail(), visit.getId());
        return visit;
    }

    Visitor getOrCreateVisitor(String fullName, String email, String phone, String idNumber) {
        return visitorRepository.findFirstByFullNameAndEmailOrderByIdAsc(fullName, email)
                .orElseGet(() -> {
                    Visitor created = visitorRepository.save(Visitor.builder()
                            .fullName(fullName)
                            .email(email)
                            .phone(phone)
                            .idNumber(idNumber)
                            .build());
                    log.info("Registered new visitor {} (id={})", fullName, created.getId());
                    return created;
                });
    }

    // Existing hosts keep their stored name, department and phone.
    Host getOrCreateHost(String hostEmail) {
        return hostRepository.findByEmail(hostEmail)
                .orElseGet(() -> {
                    try {
                        return hostRegistrationService.registerHost(hostEmail);
                    } catch (DataIntegrityViolationException e) {
                        // a concurrent check-in registered the same host first
                        log.info("Host {} registered concurrently, reusing it", hostEmail);
                        return hostRepository.findByEmail(hostEmail).orElseThrow(() -> e);
                    }
                });
    }

    // =========================================================
    // LIFECYCLE
    // =========================================================

    /**
     * @throws IllegalArgumentException when the visit does not exist
     * @throws IllegalStateException when the visit is no longer checked in
     */
    @Transactional
    public VisitLog checkOut(Long visitLogId) {
        VisitLog visit = requireCheckedIn(visitLogId);
        visit.setStatus(VisitLog.Status.CHECKED_OUT);
        visit.setCheckOutTime(Instant.now());
        log.info("Checked out visitLog={}", visitLogId);
        return visitLogRepository.save(visit);
    }

    /**
     * @throws IllegalArgumentException when the visit does not exist
     * @throws IllegalStateException when the visit is no longer checked in
     */
    @Transactional
    public VisitLog cancel(Long visitLogId) {
        VisitLog visit = requireCheckedIn(visitLogId);
        visit.setStatus(VisitLog.Status.CANCELLED);
        log.info("Cancelled visitLog={}", visitLogId);
        return visitLogRepository.save(visit);
    }

    private VisitLog requireCheckedIn(Long visitLogId) {
        VisitLog visit = visitLogRepository.findWithPartiesById(visitLogId)
                .orElseThrow(() -> new IllegalArgumentException("Visit log not found: " + visitLogId));
        if (visit.getStatus() != VisitLog.Status.CHECKED_IN) {
            throw new IllegalStateException("Visit is " + visit.getStatus().value());
        }
        return visit;
    }

    // =========================================================
    // HELPERS
    // =========================================================

    private void warnIfInvalid(CheckinField field, String value) {
        if (value != null && !fieldValidationService.isValid(field.getKey(), value)) {
            log.warn("Storing {} that fails validation", field.getKey());
        }
    }

    private static String text(Map<String, ?> payload, CheckinField field) {
        if (payload == null) return null;
        Object raw = payload.get(field.getKey());
        return raw == null ? null : StringUtils.trimToNull(raw.toString());
    }

    private static Map<String, String> asStringMap(Map<String, ?> payload) {
        Map<String, String> out = new HashMap<>();
        payload.forEach((k, v) -> out.put(k, Objects.toString(v, null)));
        return out;
    }
}
