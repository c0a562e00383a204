package io.switchboard.core.error;

/**
 * Base type for failures the gateway reports back to its caller. Each subtype
 * carries a stable error code and the HTTP status it maps to.
 */
public abstract class RelayException extends RuntimeException {
    private final String code;
    private final int httpStatus;

    protected RelayException(String code, int httpStatus, String message) {
        super(message);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    protected RelayException(String code, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
