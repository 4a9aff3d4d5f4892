package dev.univer.reportdispatcher.exception;

/** Transient mail transport failure. Retryable. */
public class NotificationUnavailableException extends RuntimeException {
    public NotificationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
