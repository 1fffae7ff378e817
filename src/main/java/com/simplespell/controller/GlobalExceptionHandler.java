package com.simplespell.controller;

import com.simplespell.data.CorpusLoadException;
import com.simplespell.data.NotInitializedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotInitializedException.class)
    public ResponseEntity<Map<String, Object>> handleNotInitialized(NotInitializedException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "corpus_not_built", ex.getMessage());
    }

    @ExceptionHandler(CorpusLoadException.class)
    public ResponseEntity<Map<String, Object>> handleCorpusLoad(CorpusLoadException ex) {
        log.warn("Corpus load failed for {}", ex.getLocation());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "corpus_load_failed", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
