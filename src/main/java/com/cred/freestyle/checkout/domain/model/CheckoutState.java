package com.cred.freestyle.checkout.domain.model;

/**
 * States of a single checkout attempt.
 *
 * <pre>
 * VALIDATING -> PRICING -> COMMITTING -> COMMITTED
 *      |            |           |
 *      +------------+-----------+------> ROLLED_BACK
 * </pre>
 *
 * @author Checkout Team
 */
public enum CheckoutState {

    /**
     * Products are being read under lock and checked for existence and stock.
     */
    VALIDATING,

    /**
     * Total is being computed from the prices read while validating.
     */
    PRICING,

    /**
     * Order, line items and stock decrements are being written.
     */
    COMMITTING,

    /**
     * All writes are durable.
     */
    COMMITTED,

    /**
     * Nothing was written.
     */
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }

    /**
     * Check that moving from this state to {@code next} is allowed.
     *
     * @param next Target state
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(CheckoutState next) {
        if (next == ROLLED_BACK) {
            return !isTerminal();
        }
        switch (this) {
            case VALIDATING:
                return next == PRICING;
            case PRICING:
                return next == COMMITTING;
            case COMMITTING:
                return next == COMMITTED;
            default:
                return false;
        }
    }
}
