package io.warden.audit;

/**
 * An entry could not be made durable. The chain's guarantees no longer hold for the caller's
 * operation, so this is never caught and ignored by the engine.
 */
public class LedgerWriteException extends RuntimeException {
    public LedgerWriteException(String message) {
        super(message);
    }

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
