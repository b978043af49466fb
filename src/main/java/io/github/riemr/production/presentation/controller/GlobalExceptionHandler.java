package io.github.riemr.production.presentation.controller;

import io.github.riemr.production.domain.exception.GraphException;
import io.github.riemr.production.domain.exception.SchedulingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SchedulingException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleScheduling(SchedulingException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Scheduling request failed: {}", e.getMessage(), e);
        } else {
            log.warn("Scheduling request rejected: {} {}", e.getCode(), e.getMessage());
        }

        Map<String, Object> response = new HashMap<>();
        response.put("error", status.getReasonPhrase());
        response.put("code", e.getCode().name());
        response.put("message", e.getMessage());
        if (e instanceof GraphException g) {
            response.put("stepIds", g.getStepIds());
        }
        return new ResponseEntity<>(response, status);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException e) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage());
        }
        Map<String, Object> response = new HashMap<>();
        response.put("error", HttpStatus.BAD_REQUEST.getReasonPhrase());
        response.put("code", "INVALID_REQUEST");
        response.put("fields", fields);
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unhandled exception occurred", e);

        Map<String, Object> response = new HashMap<>();
        response.put("error", "Internal Server Error");
        response.put("message", e.getMessage());
        response.put("exceptionType", e.getClass().getSimpleName());

        Throwable rootCause = getRootCause(e);
        response.put("rootCause", rootCause.getClass().getSimpleName());
        response.put("rootCauseMessage", rootCause.getMessage());

        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    static HttpStatus statusOf(SchedulingException e) {
        switch (e.getCode()) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONCURRENCY_CONFLICT:
            case ORDER_COMPLETED:
            case ENTRY_ALREADY_COMPLETED:
                return HttpStatus.CONFLICT;
            case PERSISTENCE_FAILURE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case GENERATION_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private Throwable getRootCause(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }
}
