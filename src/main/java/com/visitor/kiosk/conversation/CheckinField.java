package com.visitor.kiosk.conversation;

/**
 * Fixed, ordered script of the check-in interview. Declaration order is the
 * order in which fields are asked.
 */
public enum CheckinField {
    FULL_NAME("full_name", "What is your full name?"),
    EMAIL("email", "What is your email address? (You may skip)"),
    PHONE("phone", "And your phone number? (optional)"),
    ID_NUMBER("id_number", "Do you have an ID or passport number to provide? (optional)"),
    HOST_EMAIL("host_email", "Who are you visiting today? Please provide their email."),
    PURPOSE("purpose", "What is the purpose of your visit?");

    private final String key;
    private final String prompt;

    CheckinField(String key, String prompt) {
        this.key = key;
        this.prompt = prompt;
    }

    /** Key used in the conversation state map and in finalize payloads. */
    public String getKey() {
        return key;
    }

    public String getPrompt() {
        return prompt;
    }
}
