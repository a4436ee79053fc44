package com.cred.freestyle.checkout.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Product entity: one row of the inventory store.
 * Holds the authoritative price and the remaining sellable stock.
 *
 * Stock is only ever lowered through
 * {@link com.cred.freestyle.checkout.repository.ProductRepository#decrementStock(Long, Integer)}.
 *
 * @author Checkout Team
 */
@Entity
@Table(name = "products")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    /**
     * Display name of the product.
     */
    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Current catalog price. Checkout snapshots this value into each line item.
     */
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    /**
     * Remaining sellable quantity. Never negative.
     */
    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (stock == null) {
            stock = 0;
        }
    }
}
