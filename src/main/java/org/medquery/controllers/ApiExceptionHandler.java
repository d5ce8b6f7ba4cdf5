package org.medquery.controllers;

import lombok.extern.slf4j.Slf4j;
import org.medquery.exceptions.FieldSetException;
import org.medquery.exceptions.MedQueryException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MedQueryException.class)
    public ResponseEntity<Map<String, Object>> handleMedQuery(MedQueryException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("{}: {}", e.getCode(), e.getMessage());
        } else {
            log.info("{}: {}", e.getCode(), e.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getCode());
        body.put("message", e.getMessage());
        if (e instanceof FieldSetException fieldSet) {
            body.put("fields", fieldSet.getFields());
        }
        return ResponseEntity.status(e.getStatus()).body(body);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }
}
