package com.visitor.kiosk.controller;

import com.visitor.kiosk.conversation.CheckinStepResult;
import com.visitor.kiosk.dto.CheckinStepRequest;
import com.visitor.kiosk.dto.CheckinStepResponse;
import com.visitor.kiosk.dto.VisitLogDto;
import com.visitor.kiosk.entity.VisitLog;
import com.visitor.kiosk.service.CheckinInterviewService;
import com.visitor.kiosk.service.VisitService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Function;

@RestController
@RequestMapping("/api/visitor")
@Tag(name = "visitor", description = "Visitor check-in and management")
public class VisitorController {

    private static final Logger log = LoggerFactory.getLogger(VisitorController.class);

    static final String MISSING_FIELDS = "Missing required check-in fields.";

    private final CheckinInterviewService interviewService;
    private final VisitService visitService;

    public VisitorController(CheckinInterviewService interviewService, VisitService visitService) {
        this.interviewService = interviewService;
        this.visitService = visitService;
    }

    @Operation(summary = "Conversational visitor check-in step",
            description = "Receives user input and partial conversation state, returns the next prompt, "
                    + "next expected field and updated state.")
    @PostMapping("/checkin-step")
    public CheckinStepResponse checkinStep(@RequestBody CheckinStepRequest request) {
        CheckinStepResult result = interviewService.step(request.getConversationState(), request.getUserInput());
        log.debug("Check-in step ({}) -> next={} complete={}",
                request.getInputMode(), result.getNextField(), result.isComplete());
        return CheckinStepResponse.from(result);
    }

    @Operation(summary = "Finalize visitor check-in",
            description = "Creates (or retrieves) the visitor and host and records a new visit.")
    @PostMapping("/checkin-finalize")
    public ResponseEntity<?> finalizeCheckin(@RequestBody Map<String, Object> payload) {
        if (!hasText(payload, "full_name") || !hasText(payload, "host_email")) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("detail", MISSING_FIELDS));
        }
        VisitLog visit = visitService.finalizeCheckin(payload);
        return ResponseEntity.ok(VisitLogDto.from(visit));
    }

    @Operation(summary = "Check a visitor out")
    @PostMapping("/visitlogs/{id}/checkout")
    public ResponseEntity<?> checkOut(@PathVariable("id") Long id) {
        return transition(id, visitService::checkOut);
    }

    @Operation(summary = "Cancel a visit that is still checked in")
    @PostMapping("/visitlogs/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("id") Long id) {
        return transition(id, visitService::cancel);
    }

    private ResponseEntity<?> transition(Long id, Function<Long, VisitLog> action) {
        try {
            return ResponseEntity.ok(VisitLogDto.from(action.apply(id)));
        } catch (IllegalArgumentException e) {
            log.warn("Visit transition rejected for {}: {}", id, e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("detail", e.getMessage()));
        } catch (IllegalStateException e) {
            log.warn("Visit transition rejected for {}: {}", id, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("detail", e.getMessage()));
        }
    }

    private static boolean hasText(Map<String, Object> payload, String key) {
        Object v = payload == null ? null : payload.get(key);
        return v != null && StringUtils.hasText(v.toString());
    }
}
