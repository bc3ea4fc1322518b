package com.apistack.service.storage;

import io.minio.http.Method;

/**
 * What a signed URL allows its holder to do.
 */
public enum AccessMode {
    READ(Method.GET),
    WRITE(Method.PUT);

    private final Method method;

    AccessMode(Method method) {
        this.method = method;
    }

    public Method getMethod() {
        return method;
    }
}
