package com.cred.freestyle.checkout.exception;

/**
 * Exception thrown when a checkout references a product that does not exist.
 *
 * @author Checkout Team
 */
public class ProductNotFoundException extends RuntimeException {

    private final Long productId;

    public ProductNotFoundException(Long productId) {
        super(String.format("Product %d not found", productId));
        this.productId = productId;
    }

    public Long getProductId() {
        return productId;
    }
}
