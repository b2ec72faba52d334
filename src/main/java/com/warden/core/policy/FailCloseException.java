package com.warden.core.policy;

/**
 * Raised inside the engine when adjudication cannot complete. The engine
 * never lets it escape: it is converted into a DENY tagged with
 * {@link PolicyIds#FAIL_CLOSE}.
 */
public class FailCloseException extends PolicyException {

    public FailCloseException(String message, Throwable cause) {
        super(message, PolicyIds.FAIL_CLOSE, cause);
    }

    @Override
    public String toString() {
        Throwable cause = getCause();
        return "FailClose[" + getPolicyId() + "]: " + getMessage()
                + (cause != null ? " (cause: " + cause.getClass().getSimpleName() + ")" : "");
    }
}
