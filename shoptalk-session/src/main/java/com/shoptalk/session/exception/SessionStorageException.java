package com.shoptalk.session.exception;

import org.springframework.http.HttpStatus;

public class SessionStorageException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public SessionStorageException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static SessionStorageException storageUnavailable(String sessionId, Throwable cause) {
        return new SessionStorageException(
                String.format("Session storage unavailable for session %s", sessionId),
                HttpStatus.SERVICE_UNAVAILABLE,
                "SESSION_STORAGE_UNAVAILABLE",
                cause
        );
    }
}
