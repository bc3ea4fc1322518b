package com.apistack.common.exception;

/**
 * Exception raised by cache and counter stores.
 * Never reaches a client: callers recover locally.
 */
public class CacheException extends ApiStackException {

    public CacheException(String message, Throwable cause) {
        super(ErrorCode.CACHE_UNREACHABLE, message, cause);
    }

    public CacheException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
