package com.gt.vocab.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class RestExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionAdvice.class);

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleBadRequest(IllegalArgumentException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return Map.of("error", String.valueOf(ex.getMessage()));
    }

    // Illegal state transitions, e.g. reviewing a deactivated item
    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, String> handleConflict(IllegalStateException ex) {
        log.info("Request conflicts with review item state: {}", ex.getMessage());
        return Map.of("error", String.valueOf(ex.getMessage()));
    }
}
