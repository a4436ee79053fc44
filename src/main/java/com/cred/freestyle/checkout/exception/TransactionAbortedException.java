package com.cred.freestyle.checkout.exception;

/**
 * Exception thrown when the database fails, times out or refuses to commit during checkout.
 * Nothing from the checkout has been persisted. The caller may retry the whole checkout.
 *
 * @author Checkout Team
 */
public class TransactionAbortedException extends RuntimeException {

    public TransactionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
