package com.cred.freestyle.checkout.service;

import com.cred.freestyle.checkout.domain.model.Product;
import com.cred.freestyle.checkout.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for reading the product catalog.
 *
 * @author Checkout Team
 */
@Service
@Transactional(readOnly = true)
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    /**
     * Find all products.
     *
     * @return List of products ordered by ID
     */
    public List<Product> findAllProducts() {
        logger.debug("Finding all products");
        return productRepository.findAllByOrderByIdAsc();
    }

    /**
     * Find product by ID.
     *
     * @param id Product ID
     * @return Product if found
     */
    public Optional<Product> findProductById(Long id) {
        logger.debug("Finding product by ID: {}", id);
        return productRepository.findById(id);
    }
}
