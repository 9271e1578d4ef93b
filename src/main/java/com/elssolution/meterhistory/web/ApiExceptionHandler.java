package com.elssolution.meterhistory.web;

import com.elssolution.meterhistory.service.HistoryServiceException;
import com.elssolution.meterhistory.service.HistoryValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps engine errors to HTTP: validation → 400, backend → 503. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    public record ErrorBody(String error, String message) {}

    @ExceptionHandler(HistoryValidationException.class)
    public ResponseEntity<ErrorBody> onValidation(HistoryValidationException e) {
        log.debug("history_rejected reason={} msg={}", e.getReason().code(), e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorBody(e.getReason().code(), e.getMessage()));
    }

    @ExceptionHandler(HistoryServiceException.class)
    public ResponseEntity<ErrorBody> onService(HistoryServiceException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorBody(e.getReason().code(), e.getMessage()));
    }
}
