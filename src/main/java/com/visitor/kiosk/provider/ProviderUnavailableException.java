package com.visitor.kiosk.provider;

/**
 * Raised by an AI capability provider that is not configured or whose
 * upstream call failed. Callers turn it into a fallback payload.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
