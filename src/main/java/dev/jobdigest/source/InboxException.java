package dev.jobdigest.source;

/**
 * An inbox operation failed.
 */
public class InboxException extends RuntimeException {

    public InboxException(String message) {
        super(message);
    }

    public InboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
