package com.cred.freestyle.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the checkout service.
 *
 * System Overview:
 * - User signup and login with BCrypt password hashing
 * - Signed bearer tokens (HS256 JWT, 1 hour validity) for protected endpoints
 * - Product catalog reads
 * - Atomic checkout: stock verification, authoritative pricing, order + line items
 *   + stock decrement committed together or not at all
 * - Order history and order detail with ownership checks
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: checkout transaction engine, order queries, catalog, identity
 * - Data Access Layer: JPA repositories with row locks and conditional updates
 * - Infrastructure Layer: Micrometer metrics
 *
 * @author Checkout Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class CheckoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckoutApplication.class, args);
    }
}
