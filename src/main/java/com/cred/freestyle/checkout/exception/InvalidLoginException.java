package com.cred.freestyle.checkout.exception;

/**
 * Exception thrown when login fails because the email is unknown or the password does not match.
 *
 * @author Checkout Team
 */
public class InvalidLoginException extends RuntimeException {

    public InvalidLoginException(String message) {
        super(message);
    }
}
