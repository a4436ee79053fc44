package com.cred.freestyle.checkout.api.dto;

import com.cred.freestyle.checkout.service.CheckoutReceipt;

import java.math.BigDecimal;

/**
 * Response DTO for a committed checkout.
 *
 * @author Checkout Team
 */
public class CheckoutResponse {

    private String message;
    private Long orderId;
    private BigDecimal totalAmount;

    public CheckoutResponse() {
    }

    /**
     * Create response from a checkout receipt.
     *
     * @param receipt Receipt returned by the checkout engine
     * @return CheckoutResponse
     */
    public static CheckoutResponse fromReceipt(CheckoutReceipt receipt) {
        CheckoutResponse response = new CheckoutResponse();
        response.setMessage("Order placed successfully");
        response.setOrderId(receipt.getOrderId());
        response.setTotalAmount(receipt.getTotalAmount());
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Long getOrderId() {
        return orderId;
    }

    public void setOrderId(Long orderId) {
        this.orderId = orderId;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(BigDecimal totalAmount) {
        this.totalAmount = totalAmount;
    }
}
