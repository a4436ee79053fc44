package com.cred.freestyle.checkout.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for checkout/order creation.
 * Expected body: {@code { "items": [ { "productId": 1, "quantity": 2 }, ... ] }}
 *
 * @author Checkout Team
 */
public class CheckoutRequest {

    @NotEmpty(message = "At least one item is required")
    private List<@NotNull(message = "Item must not be null") @Valid CheckoutItemRequest> items = new ArrayList<>();

    public CheckoutRequest() {
    }

    public CheckoutRequest(List<CheckoutItemRequest> items) {
        this.items = items;
    }

    public List<CheckoutItemRequest> getItems() {
        return items;
    }

    public void setItems(List<CheckoutItemRequest> items) {
        this.items = items;
    }
}
