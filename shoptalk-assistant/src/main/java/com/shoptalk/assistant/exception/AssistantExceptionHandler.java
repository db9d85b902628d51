package com.shoptalk.assistant.exception;

import com.shoptalk.session.exception.SessionStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "com.shoptalk.assistant")
public class AssistantExceptionHandler {

    @ExceptionHandler(AssistantException.class)
    public ResponseEntity<Map<String, Object>> handleAssistantException(AssistantException ex) {
        log.warn("Assistant exception: {}", ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(body(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(SessionStorageException.class)
    public ResponseEntity<Map<String, Object>> handleSessionStorageException(SessionStorageException ex) {
        log.error("Session storage failure: {}", ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(body(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        log.warn("Invalid chat request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(message, "INVALID_MESSAGE"));
    }

    private Map<String, Object> body(String error, String errorCode) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("error", error);
        body.put("errorCode", errorCode);
        return body;
    }
}
