package com.apistack.common.exception;

/**
 * Exception thrown when a bearer token cannot be turned into an authenticated principal.
 */
public class AuthException extends ApiStackException {

    public enum Kind {
        MISSING(ErrorCode.AUTH_MISSING),
        MALFORMED(ErrorCode.AUTH_MALFORMED),
        EXPIRED(ErrorCode.AUTH_EXPIRED),
        INVALID_SIGNATURE(ErrorCode.AUTH_INVALID_SIGNATURE);

        private final ErrorCode errorCode;

        Kind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ErrorCode errorCode() {
            return errorCode;
        }
    }

    private final Kind kind;

    public AuthException(Kind kind) {
        super(kind.errorCode());
        this.kind = kind;
    }

    public AuthException(Kind kind, String message) {
        super(kind.errorCode(), message);
        this.kind = kind;
    }

    public AuthException(Kind kind, String message, Throwable cause) {
        super(kind.errorCode(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
