package com.cred.freestyle.checkout.service;

/**
 * One requested (productId, quantity) pair of a checkout.
 * Carries no price: prices always come from the catalog.
 *
 * @author Checkout Team
 */
public class CheckoutItem {

    private final Long productId;
    private final Integer quantity;

    public CheckoutItem(Long productId, Integer quantity) {
        this.productId = productId;
        this.quantity = quantity;
    }

    public Long getProductId() {
        return productId;
    }

    public Integer getQuantity() {
        return quantity;
    }

    @Override
    public String toString() {
        return "CheckoutItem{productId=" + productId + ", quantity=" + quantity + "}";
    }
}
