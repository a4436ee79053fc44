package com.cred.freestyle.checkout.api.dto;

import com.cred.freestyle.checkout.domain.model.Order;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for one order with its line items.
 *
 * @author Checkout Team
 */
public class OrderDetailResponse extends OrderResponse {

    private List<OrderItemResponse> items;

    public OrderDetailResponse() {
    }

    /**
     * Create response from Order entity. Line items and their products must be loaded.
     *
     * @param order Order entity
     * @return OrderDetailResponse
     */
    public static OrderDetailResponse fromEntity(Order order) {
        OrderDetailResponse response = new OrderDetailResponse();
        copyFields(order, response);
        response.setItems(order.getLineItems().stream()
                .map(OrderItemResponse::fromEntity)
                .collect(Collectors.toList()));
        return response;
    }

    public List<OrderItemResponse> getItems() {
        return items;
    }

    public void setItems(List<OrderItemResponse> items) {
        this.items = items;
    }
}
