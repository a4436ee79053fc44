package com.cred.freestyle.checkout.exception;

/**
 * Exception thrown when a bearer token is malformed, badly signed or expired.
 *
 * @author Checkout Team
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
