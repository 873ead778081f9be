package com.lulcplatform.common.exception;

/**
 * Raised only for caller misuse of the analytics core. Messy input data is
 * never reported through exceptions; it is recovered locally and surfaced as
 * processing notes or empty results.
 */
public class AnalyticsException extends RuntimeException {
    private final String subject;

    public AnalyticsException(String subject, String message) {
        super("[" + subject + "] " + message);
        this.subject = subject;
    }

    public AnalyticsException(String subject, String message, Throwable cause) {
        super("[" + subject + "] " + message, cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
