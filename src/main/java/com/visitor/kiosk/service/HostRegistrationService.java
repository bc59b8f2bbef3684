package com.visitor.kiosk.service;

import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.repository.HostRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts hosts first seen at check-in. Runs in its own transaction so a
 * duplicate-email insert from a concurrent check-in fails here and leaves
 * the caller's transaction usable.
 */
@Service
public class HostRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(HostRegistrationService.class);

    private final HostRepository hostRepository;

    public HostRegistrationService(HostRepository hostRepository) {
        this.hostRepository = hostRepository;
    }

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when the email is already taken
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Host registerHost(String hostEmail) {
        Host created = hostRepository.saveAndFlush(Host.builder()
                .fullName(StringUtils.substringBefore(hostEmail, "@"))
                .email(hostEmail)
                .build());
        log.info("Registered new host {} (id={})", hostEmail, created.getId());
        return created;
    }
}
