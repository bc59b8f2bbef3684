package com.visitor.kiosk.service;

import com.visitor.kiosk.conversation.CheckinField;
import com.visitor.kiosk.conversation.CheckinStepResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a visitor through the fixed check-in script one answer at a time.
 * Holds no per-visitor state: the caller sends the collected answers with
 * every step and gets an updated copy back.
 */
@Service
public class CheckinInterviewService {

    private static final Logger log = LoggerFactory.getLogger(CheckinInterviewService.class);

    static final String COMPLETION_PROMPT =
            "Thank you, your check-in data is almost complete. Please scan your ID, if required.";

    private final FieldValidationService fieldValidationService;

    public CheckinInterviewService(FieldValidationService fieldValidationService) {
        this.fieldValidationService = fieldValidationService;
    }

    /**
     * Applies one raw answer to the first unanswered field.
     *
     * @param conversationState answers collected so far, may be null or partial
     * @param userInput raw spoken or typed answer, blank input assigns nothing
     */
    public CheckinStepResult step(Map<String, String> conversationState, String userInput) {
        Map<String, String> state = conversationState == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(conversationState);
        List<String> errors = new ArrayList<>();

        Optional<CheckinField> pending = firstMissing(state);
        String answer = StringUtils.trimToEmpty(userInput);

        if (pending.isPresent() && !answer.isEmpty()) {
            CheckinField field = pending.get();
            state.put(field.getKey(), answer);
            // invalid answers are still kept, the caller decides whether to re-ask
            validateAnswer(field, answer, errors);
            log.debug("Check-in answer stored for {} (errors={})", field.getKey(), errors.size());
            pending = firstMissing(state);
        }

        if (pending.isEmpty()) {
            return new CheckinStepResult(COMPLETION_PROMPT, null, state, true, errors);
        }
        CheckinField next = pending.get();
        return new CheckinStepResult(next.getPrompt(), next, state, false, errors);
    }

    /** Fields in script order that still lack a non-empty answer. */
    public List<CheckinField> missingFields(Map<String, String> state) {
        List<CheckinField> missing = new ArrayList<>();
        for (CheckinField field : CheckinField.values()) {
            if (isMissing(state, field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    private Optional<CheckinField> firstMissing(Map<String, String> state) {
        for (CheckinField field : CheckinField.values()) {
            if (isMissing(state, field)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    // An empty answer counts as unanswered, so optional fields are always asked.
    private static boolean isMissing(Map<String, String> state, CheckinField field) {
        return StringUtils.isEmpty(state.get(field.getKey()));
    }

    private void validateAnswer(CheckinField field, String answer, List<String> errors) {
        switch (field) {
            case EMAIL:
                if (!fieldValidationService.isValid(field.getKey(), answer)) {
                    errors.add("Invalid email format.");
                }
                break;
            case HOST_EMAIL:
                if (!answer.contains("@")) {
                    errors.add("Please provide a valid email for the host.");
                }
                break;
            default:
                break;
        }
    }
}
