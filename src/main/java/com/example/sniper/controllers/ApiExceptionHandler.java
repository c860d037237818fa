package com.example.sniper.controllers;

import com.example.sniper.service.exception.InvalidWatchException;
import com.example.sniper.service.exception.MissingCredentialException;
import com.example.sniper.service.exception.RemoteCallException;
import com.example.sniper.service.exception.WatchNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "com.example.sniper")
public class ApiExceptionHandler {

    @ExceptionHandler({InvalidWatchException.class, MissingCredentialException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("invalid request");
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    @ExceptionHandler(WatchNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(WatchNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RemoteCallException.class)
    public ResponseEntity<Map<String, String>> handleRemote(RemoteCallException e) {
        log.warn("Booking platform call failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, String>> handleRejected(TaskRejectedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Too many scans queued, try again shortly"));
    }
}
