package dev.univer.reportdispatcher.exception;

/** Transient store failure (connection loss, timeout). Retryable. */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
