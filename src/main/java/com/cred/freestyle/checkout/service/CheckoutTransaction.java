package com.cred.freestyle.checkout.service;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

/**
 * Scoped handle on one checkout transaction.
 *
 * Opened with {@link #begin}, ended by exactly one of {@link #commit()} or
 * {@link #rollback()}. {@link #close()} rolls back whatever has not been
 * committed, so a try-with-resources block never leaks an open transaction.
 *
 * @author Checkout Team
 */
final class CheckoutTransaction implements AutoCloseable {

    private final PlatformTransactionManager transactionManager;
    private final TransactionStatus status;
    private boolean completed;

    private CheckoutTransaction(PlatformTransactionManager transactionManager, TransactionStatus status) {
        this.transactionManager = transactionManager;
        this.status = status;
    }

    static CheckoutTransaction begin(PlatformTransactionManager transactionManager,
                                     TransactionDefinition definition) {
        return new CheckoutTransaction(transactionManager, transactionManager.getTransaction(definition));
    }

    /**
     * Commit all writes. The transaction manager completes the transaction
     * (commit, or rollback on commit failure) even when this throws.
     */
    void commit() {
        if (completed) {
            throw new IllegalStateException("Checkout transaction already completed");
        }
        try {
            transactionManager.commit(status);
        } finally {
            completed = true;
        }
    }

    /**
     * Discard all writes. No-op once the transaction is completed.
     */
    void rollback() {
        if (completed) {
            return;
        }
        try {
            transactionManager.rollback(status);
        } finally {
            completed = true;
        }
    }

    @Override
    public void close() {
        rollback();
    }
}
