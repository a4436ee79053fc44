package com.cred.freestyle.checkout.testutil;

import com.cred.freestyle.checkout.domain.model.Order;
import com.cred.freestyle.checkout.domain.model.OrderLineItem;
import com.cred.freestyle.checkout.domain.model.Product;
import com.cred.freestyle.checkout.domain.model.UserAccount;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Builder class for creating test data objects.
 * Provides fluent API for building domain models with sensible defaults.
 */
public class TestDataBuilder {

    /**
     * Builder for Product
     */
    public static class ProductBuilder {
        private Long id;
        private String name = "Test Product";
        private String description = "Test product description";
        private BigDecimal price = new BigDecimal("10.00");
        private Integer stock = 5;

        public ProductBuilder id(Long id) {
            this.id = id;
            return this;
        }

        public ProductBuilder name(String name) {
            this.name = name;
            return this;
        }

        public ProductBuilder description(String description) {
            this.description = description;
            return this;
        }

        public ProductBuilder price(String price) {
            this.price = new BigDecimal(price);
            return this;
        }

        public ProductBuilder stock(Integer stock) {
            this.stock = stock;
            return this;
        }

        public Product build() {
            Product product = new Product();
            product.setId(id);
            product.setName(name);
            product.setDescription(description);
            product.setPrice(price);
            product.setStock(stock);
            return product;
        }
    }

    /**
     * Builder for UserAccount
     */
    public static class UserBuilder {
        private Long id;
        private String name = "Test User";
        private String email = "user-" + UUID.randomUUID() + "@example.com";
        private String passwordHash = "$2a$10$hash";

        public UserBuilder id(Long id) {
            this.id = id;
            return this;
        }

        public UserBuilder name(String name) {
            this.name = name;
            return this;
        }

        public UserBuilder email(String email) {
            this.email = email;
            return this;
        }

        public UserBuilder passwordHash(String passwordHash) {
            this.passwordHash = passwordHash;
            return this;
        }

        public UserAccount build() {
            UserAccount user = new UserAccount();
            user.setId(id);
            user.setName(name);
            user.setEmail(email);
            user.setPasswordHash(passwordHash);
            return user;
        }
    }

    /**
     * Builder for Order. Line items are added with {@link #item(Product, int)}
     * at the product's current price; the total follows them.
     */
    public static class OrderBuilder {
        private Long id;
        private Long userId = 1L;
        private Instant createdAt = Instant.now();
        private final Order order = Order.builder().build();

        public OrderBuilder id(Long id) {
            this.id = id;
            return this;
        }

        public OrderBuilder userId(Long userId) {
            this.userId = userId;
            return this;
        }

        public OrderBuilder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public OrderBuilder item(Product product, int quantity) {
            order.addLineItem(OrderLineItem.builder()
                    .id((long) order.getLineItems().size() + 1)
                    .product(product)
                    .quantity(quantity)
                    .unitPrice(product.getPrice())
                    .build());
            return this;
        }

        public Order build() {
            order.setId(id);
            order.setUserId(userId);
            order.setCreatedAt(createdAt);
            order.setTotalAmount(order.getLineItems().stream()
                    .map(OrderLineItem::getLineTotal)
                    .reduce(BigDecimal.ZERO, BigDecimal::add));
            return order;
        }
    }

    // Convenience methods
    public static ProductBuilder aProduct() {
        return new ProductBuilder();
    }

    public static UserBuilder aUser() {
        return new UserBuilder();
    }

    public static OrderBuilder anOrder() {
        return new OrderBuilder();
    }
}
