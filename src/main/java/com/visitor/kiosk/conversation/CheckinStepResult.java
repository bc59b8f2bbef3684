package com.visitor.kiosk.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one interview step. The updated state is a fresh copy, the
 * caller's map is never touched.
 */
public final class CheckinStepResult {

    private final String nextPrompt;
    private final CheckinField nextField;
    private final Map<String, String> state;
    private final boolean complete;
    private final List<String> errors;

    public CheckinStepResult(String nextPrompt, CheckinField nextField, Map<String, String> state,
                             boolean complete, List<String> errors) {
        this.nextPrompt = nextPrompt;
        this.nextField = nextField;
        this.state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
        this.complete = complete;
        this.errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
    }

    public String getNextPrompt() {
        return nextPrompt;
    }

    /** Null once every field is answered. */
    public CheckinField getNextField() {
        return nextField;
    }

    public Map<String, String> getState() {
        return state;
    }

    public boolean isComplete() {
        return complete;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
