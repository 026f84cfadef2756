package com.example.secureshare.web;

import org.springframework.http.HttpStatus;

/**
 * A failure with a status and a message meant for the API caller.
 */
public class HttpError extends RuntimeException {

    private final HttpStatus status;

    public HttpError(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public static HttpError badRequest(String message) {
        return new HttpError(message, HttpStatus.BAD_REQUEST);
    }

    public static HttpError notFound(String message) {
        return new HttpError(message, HttpStatus.NOT_FOUND);
    }

    public static HttpError unauthorized(String message) {
        return new HttpError(message, HttpStatus.UNAUTHORIZED);
    }

    public HttpStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "HttpError: message: " + getMessage() + ", status: " + status;
    }
}
