package com.example.secureshare.service;

/**
 * Raised when a user is created with an email that is already registered.
 */
public class EmailAlreadyExistsException extends RuntimeException {

    private final String email;

    public EmailAlreadyExistsException(String email) {
        super("A user with this email already exists");
        this.email = email;
    }

    public EmailAlreadyExistsException(String email, Throwable cause) {
        super("A user with this email already exists", cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
