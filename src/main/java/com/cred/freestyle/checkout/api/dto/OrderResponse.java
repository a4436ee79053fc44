package com.cred.freestyle.checkout.api.dto;

import com.cred.freestyle.checkout.domain.model.Order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for an order in the order history list.
 *
 * @author Checkout Team
 */
public class OrderResponse {

    private Long id;
    private Long userId;
    private BigDecimal totalAmount;
    private Instant createdAt;

    public OrderResponse() {
    }

    /**
     * Create response from Order entity.
     *
     * @param order Order entity
     * @return OrderResponse
     */
    public static OrderResponse fromEntity(Order order) {
        OrderResponse response = new OrderResponse();
        copyFields(order, response);
        return response;
    }

    static void copyFields(Order order, OrderResponse response) {
        response.setId(order.getId());
        response.setUserId(order.getUserId());
        response.setTotalAmount(order.getTotalAmount());
        response.setCreatedAt(order.getCreatedAt());
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(BigDecimal totalAmount) {
        this.totalAmount = totalAmount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
