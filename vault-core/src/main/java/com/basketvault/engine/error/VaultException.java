package com.basketvault.engine.error;

/** Raised by every engine component; validation failures are raised before any state is touched. */
public class VaultException extends RuntimeException {

    private final VaultErrorCode code;

    public VaultException(VaultErrorCode code, String message) {
        super(code.getDescription() + ": " + message);
        this.code = code;
    }

    public VaultException(VaultErrorCode code, String message, Throwable cause) {
        super(code.getDescription() + ": " + message, cause);
        this.code = code;
    }

    public VaultErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
