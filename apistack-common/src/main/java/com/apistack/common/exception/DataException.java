package com.apistack.common.exception;

/**
 * Exception thrown when data access fails.
 * Engine-specific error shapes are normalized into {@link Kind} before this is thrown.
 */
public class DataException extends ApiStackException {

    public enum Kind {
        NOT_FOUND(ErrorCode.DATA_NOT_FOUND),
        CONFLICT(ErrorCode.DATA_CONFLICT),
        CONNECTION_LOST(ErrorCode.DATA_CONNECTION_LOST),
        TIMEOUT(ErrorCode.DATA_TIMEOUT),
        OTHER(ErrorCode.DATA_FAILED);

        private final ErrorCode errorCode;

        Kind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ErrorCode errorCode() {
            return errorCode;
        }

        /**
         * Transient kinds are worth one more attempt when they happen on connection checkout.
         */
        public boolean isTransient() {
            return this == CONNECTION_LOST || this == TIMEOUT;
        }
    }

    private final Kind kind;

    public DataException(Kind kind, String message) {
        super(kind.errorCode(), message);
        this.kind = kind;
    }

    public DataException(Kind kind, String message, Throwable cause) {
        super(kind.errorCode(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
