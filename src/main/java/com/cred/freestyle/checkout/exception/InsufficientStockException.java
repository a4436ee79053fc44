package com.cred.freestyle.checkout.exception;

/**
 * Exception thrown when a checkout asks for more units than a product has left.
 * The whole checkout is rolled back before this is raised.
 *
 * @author Checkout Team
 */
public class InsufficientStockException extends RuntimeException {

    private final Long productId;
    private final Integer requestedQuantity;

    public InsufficientStockException(Long productId, Integer requestedQuantity) {
        super(String.format("Insufficient stock for product %d. Requested: %d",
                productId, requestedQuantity));
        this.productId = productId;
        this.requestedQuantity = requestedQuantity;
    }

    public Long getProductId() {
        return productId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }
}
