package com.ocibiz.suppression.domain;

/** Thrown when removal is requested for an address that is not on the suppression list. */
public class SuppressionNotFoundException extends RuntimeException {

    private final String email;

    public SuppressionNotFoundException(String email) {
        super("Email '" + email + "' is not in the suppression list");
        this.email = email;
    }

    public String email() {
        return email;
    }
}
