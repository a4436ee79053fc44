package com.cred.freestyle.checkout.api.dto;

import com.cred.freestyle.checkout.domain.model.OrderLineItem;

import java.math.BigDecimal;

/**
 * One line item of an order detail, joined with the product name.
 * {@code price} is the unit price captured when the order was placed.
 *
 * @author Checkout Team
 */
public class OrderItemResponse {

    private Long id;
    private Long productId;
    private String name;
    private Integer quantity;
    private BigDecimal price;

    public OrderItemResponse() {
    }

    public static OrderItemResponse fromEntity(OrderLineItem lineItem) {
        OrderItemResponse response = new OrderItemResponse();
        response.setId(lineItem.getId());
        response.setProductId(lineItem.getProduct().getId());
        response.setName(lineItem.getProduct().getName());
        response.setQuantity(lineItem.getQuantity());
        response.setPrice(lineItem.getUnitPrice());
        return response;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }
}
