package com.cred.freestyle.checkout.exception;

/**
 * Exception thrown when signing up with an email that already has an account.
 *
 * @author Checkout Team
 */
public class EmailAlreadyRegisteredException extends RuntimeException {

    private final String email;

    public EmailAlreadyRegisteredException(String email) {
        super(String.format("Email %s is already registered", email));
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
