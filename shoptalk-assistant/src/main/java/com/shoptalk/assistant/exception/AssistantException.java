package com.shoptalk.assistant.exception;

import org.springframework.http.HttpStatus;

public class AssistantException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public AssistantException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static AssistantException invalidMessage(String reason) {
        return new AssistantException(
                String.format("Invalid chat message: %s", reason),
                HttpStatus.BAD_REQUEST,
                "INVALID_MESSAGE"
        );
    }

    public static AssistantException sessionNotFound(String sessionId) {
        return new AssistantException(
                String.format("Session not found: %s", sessionId),
                HttpStatus.NOT_FOUND,
                "SESSION_NOT_FOUND"
        );
    }
}
