package com.example.secureshare.web;

import com.example.secureshare.auth.InvalidCredentialsException;
import com.example.secureshare.service.EmailAlreadyExistsException;
import com.example.secureshare.service.TransactionFailureException;
import com.example.secureshare.service.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.concurrent.TimeoutException;

/**
 * Renders every failure as a {@code {status, message}} envelope.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(HttpError.class)
    ResponseEntity<ErrorResponse> handleHttpError(HttpError e) {
        return fail(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    ResponseEntity<ErrorResponse> handleBindException(WebExchangeBindException e) {
        String message = e.getAllErrors().stream()
                .findFirst()
                .map(ApiExceptionHandler::describe)
                .orElse("Invalid request");
        return fail(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    ResponseEntity<ErrorResponse> handleInputException(ServerWebInputException e) {
        log.debug("Unreadable request: {}", e.getMessage());
        return fail(HttpStatus.BAD_REQUEST, "Invalid request: " + e.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return fail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    ResponseEntity<ErrorResponse> handleInvalidCredentials(InvalidCredentialsException e) {
        return fail(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(EmailAlreadyExistsException.class)
    ResponseEntity<ErrorResponse> handleEmailExists(EmailAlreadyExistsException e) {
        return fail(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(UserNotFoundException.class)
    ResponseEntity<ErrorResponse> handleUserNotFound(UserNotFoundException e) {
        return fail(HttpStatus.NOT_FOUND, "User not found");
    }

    @ExceptionHandler(TimeoutException.class)
    ResponseEntity<ErrorResponse> handleTimeout(TimeoutException e) {
        log.warn("Request timed out: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.error("Request timed out"));
    }

    @ExceptionHandler({TransactionFailureException.class, DataAccessException.class})
    ResponseEntity<ErrorResponse> handleStoreFailure(RuntimeException e) {
        log.error("Storage failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.error("Internal server error"));
    }

    @ExceptionHandler(DataBufferLimitException.class)
    ResponseEntity<ErrorResponse> handleBodyTooLarge(DataBufferLimitException e) {
        log.warn("Request body too large: {}", e.getMessage());
        return fail(HttpStatus.PAYLOAD_TOO_LARGE, "Request body is too large");
    }

    // 405, 413, 415 and other statuses raised by the framework
    @ExceptionHandler(ResponseStatusException.class)
    ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String message = e.getReason() != null ? e.getReason()
                : resolved != null ? resolved.getReasonPhrase() : "Request failed";
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", status, e);
            return ResponseEntity.status(status).body(ErrorResponse.error(message));
        }
        log.debug("Request rejected with {}: {}", status, message);
        return ResponseEntity.status(status).body(ErrorResponse.fail(message));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.error("Internal server error"));
    }

    private static ResponseEntity<ErrorResponse> fail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.fail(message));
    }

    private static String describe(ObjectError error) {
        if (error.getDefaultMessage() != null) {
            return error.getDefaultMessage();
        }
        if (error instanceof FieldError fieldError) {
            return "Invalid value for " + fieldError.getField();
        }
        return "Invalid request";
    }
}
