package com.automation.api.rest;

import com.automation.core.exception.AutomationException;
import com.automation.core.exception.AutomationValidationException;
import com.automation.core.exception.EventValidationException;
import com.automation.core.exception.InvalidEventCountParametersException;
import com.automation.core.exception.InvalidEventQueryException;
import com.automation.core.exception.InvalidPageTokenException;
import com.automation.core.exception.NotFoundException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps the automation exception hierarchy to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";

    @ExceptionHandler(AutomationValidationException.class)
    public ResponseEntity<ErrorResponse> handleAutomationValidation(AutomationValidationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY,
            new ErrorResponse(e.getErrorCode(), e.getMessage(), e.getProblems()));
    }

    @ExceptionHandler(EventValidationException.class)
    public ResponseEntity<ErrorResponse> handleEventValidation(EventValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of(e));
    }

    @ExceptionHandler(InvalidPageTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPageToken(InvalidPageTokenException e) {
        return respond(HttpStatus.FORBIDDEN, ErrorResponse.of(e));
    }

    @ExceptionHandler({InvalidEventCountParametersException.class, InvalidEventQueryException.class})
    public ResponseEntity<ErrorResponse> handleInvalidQuery(AutomationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorResponse.of(e));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.of(e));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception e) {
        return respond(HttpStatus.BAD_REQUEST,
            new ErrorResponse(MALFORMED_REQUEST, "Malformed request: " + e.getMessage(), null));
    }

    @ExceptionHandler(AutomationException.class)
    public ResponseEntity<ErrorResponse> handleAutomation(AutomationException e) {
        log.error("Request failed with {}", e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of(e));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        if (status.is4xxClientError()) {
            log.debug("Rejected request with {}: {}", status.value(), body.message());
        }
        return ResponseEntity.status(status).body(body);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        String errorCode,
        String message,
        List<String> problems
    ) {
        static ErrorResponse of(AutomationException e) {
            return new ErrorResponse(e.getErrorCode(), e.getMessage(), null);
        }
    }
}
