package com.inboxsync.api.controller;

import com.inboxsync.api.dto.ErrorBody;
import com.inboxsync.ingestion.job.SyncAlreadyRunningException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps API failures to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SyncAlreadyRunningException.class)
    public ResponseEntity<ErrorBody> handleAlreadyRunning(SyncAlreadyRunningException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("SYNC_IN_PROGRESS", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleBadInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PARAMETER", message));
    }
}
