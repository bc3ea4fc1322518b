package com.apistack.common.exception;

/**
 * Exception thrown when object storage operations fail.
 */
public class StorageException extends ApiStackException {

    public enum Kind {
        UNREACHABLE(ErrorCode.STORAGE_UNREACHABLE),
        NOT_FOUND(ErrorCode.STORAGE_NOT_FOUND),
        PERMISSION_DENIED(ErrorCode.STORAGE_PERMISSION_DENIED),
        OTHER(ErrorCode.STORAGE_FAILED);

        private final ErrorCode errorCode;

        Kind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ErrorCode errorCode() {
            return errorCode;
        }
    }

    private final Kind kind;

    public StorageException(Kind kind, String message) {
        super(kind.errorCode(), message);
        this.kind = kind;
    }

    public StorageException(Kind kind, String message, Throwable cause) {
        super(kind.errorCode(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
