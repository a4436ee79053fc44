package com.cred.freestyle.checkout.api.controller;

import com.cred.freestyle.checkout.api.dto.ProductResponse;
import com.cred.freestyle.checkout.exception.ResourceNotFoundException;
import com.cred.freestyle.checkout.infrastructure.metrics.CommerceMetricsService;
import com.cred.freestyle.checkout.service.ProductService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the product catalog. Reads are public.
 *
 * @author Checkout Team
 */
@RestController
@RequestMapping("/api/products")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;
    private final CommerceMetricsService metricsService;

    public ProductController(ProductService productService, CommerceMetricsService metricsService) {
        this.productService = productService;
        this.metricsService = metricsService;
    }

    /**
     * List all products ordered by ID.
     *
     * @return Products with current price and stock
     */
    @GetMapping
    public ResponseEntity<List<ProductResponse>> getAllProducts() {
        logger.debug("Fetching all products");

        try {
            List<ProductResponse> responses = productService.findAllProducts().stream()
                    .map(ProductResponse::fromEntity)
                    .collect(Collectors.toList());

            logger.debug("Found {} products", responses.size());
            return ResponseEntity.ok(responses);
        } catch (DataAccessException e) {
            metricsService.recordError("DATABASE_ERROR", "getAllProducts");
            throw e;
        }
    }

    /**
     * Get one product.
     *
     * @param id Product ID
     * @return Product, or 404 if it does not exist
     */
    @GetMapping("/{id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable Long id) {
        logger.debug("Fetching product: {}", id);

        return productService.findProductById(id)
                .map(ProductResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Product", String.valueOf(id)));
    }
}
