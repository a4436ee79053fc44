package com.cred.freestyle.checkout.service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of a committed checkout.
 *
 * @author Checkout Team
 */
public class CheckoutReceipt {

    private final Long orderId;
    private final BigDecimal totalAmount;
    private final int lineItemCount;
    private final Instant createdAt;

    public CheckoutReceipt(Long orderId, BigDecimal totalAmount, int lineItemCount, Instant createdAt) {
        this.orderId = orderId;
        this.totalAmount = totalAmount;
        this.lineItemCount = lineItemCount;
        this.createdAt = createdAt;
    }

    public Long getOrderId() {
        return orderId;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public int getLineItemCount() {
        return lineItemCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
