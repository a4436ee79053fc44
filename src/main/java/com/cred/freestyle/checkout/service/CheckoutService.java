package com.cred.freestyle.checkout.service;

import com.cred.freestyle.checkout.domain.model.CheckoutState;
import com.cred.freestyle.checkout.domain.model.Order;
import com.cred.freestyle.checkout.domain.model.OrderLineItem;
import com.cred.freestyle.checkout.domain.model.Product;
import com.cred.freestyle.checkout.exception.InsufficientStockException;
import com.cred.freestyle.checkout.exception.ProductNotFoundException;
import com.cred.freestyle.checkout.exception.TransactionAbortedException;
import com.cred.freestyle.checkout.infrastructure.metrics.CommerceMetricsService;
import com.cred.freestyle.checkout.repository.OrderRepository;
import com.cred.freestyle.checkout.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checkout transaction engine.
 * Turns a verified user ID and a list of (productId, quantity) pairs into one
 * committed order, or into nothing at all.
 *
 * Flow (one database transaction):
 * 1. VALIDATING: lock the referenced product rows, check existence and stock in request order
 * 2. PRICING: compute the total from the prices just read
 * 3. COMMITTING: insert order and line items, conditionally decrement each product's stock, commit
 * 4. COMMITTED, or ROLLED_BACK on the first rejection or store failure
 *
 * Concurrency control is left to the database: row locks taken in ascending
 * product ID order plus a conditional decrement that refuses to take stock
 * below zero.
 *
 * @author Checkout Team
 */
@Service
public class CheckoutService {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutService.class);

    static final String REASON_PRODUCT_NOT_FOUND = "PRODUCT_NOT_FOUND";
    static final String REASON_INSUFFICIENT_STOCK = "INSUFFICIENT_STOCK";
    static final String REASON_TRANSACTION_ABORTED = "TRANSACTION_ABORTED";

    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final PlatformTransactionManager transactionManager;
    private final CommerceMetricsService metricsService;
    private final TransactionDefinition transactionDefinition;

    public CheckoutService(
            ProductRepository productRepository,
            OrderRepository orderRepository,
            PlatformTransactionManager transactionManager,
            CommerceMetricsService metricsService,
            @Value("${commerce.checkout.transaction-timeout-seconds:10}") int transactionTimeoutSeconds
    ) {
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
        this.transactionManager = transactionManager;
        this.metricsService = metricsService;

        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setName("checkout");
        definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        definition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        definition.setTimeout(transactionTimeoutSeconds);
        this.transactionDefinition = definition;
    }

    /**
     * Place an order for the given user.
     *
     * @param userId Verified user ID
     * @param items Requested items, in request order
     * @return Receipt with the new order ID and its total
     * @throws IllegalArgumentException if the request is empty or malformed
     * @throws ProductNotFoundException if a referenced product does not exist
     * @throws InsufficientStockException if a product does not have enough stock
     * @throws TransactionAbortedException if the database failed or refused to commit
     */
    public CheckoutReceipt checkout(Long userId, List<CheckoutItem> items) {
        long startTime = System.currentTimeMillis();
        validateRequest(userId, items);

        CheckoutAttempt attempt = new CheckoutAttempt(userId, items);
        logger.info("Starting checkout for user: {}, items: {}", userId, items.size());

        try (CheckoutTransaction tx = CheckoutTransaction.begin(transactionManager, transactionDefinition)) {
            execute(attempt);

            if (attempt.isRejected()) {
                tx.rollback();
                attempt.transitionTo(CheckoutState.ROLLED_BACK);
            } else {
                tx.commit();
                attempt.transitionTo(CheckoutState.COMMITTED);
            }
        } catch (DataAccessException | TransactionException e) {
            attempt.transitionTo(CheckoutState.ROLLED_BACK);
            logger.error("Checkout aborted for user: {}", userId, e);
            metricsService.recordCheckoutFailure(REASON_TRANSACTION_ABORTED);
            metricsService.recordError("DATABASE_ERROR", "checkout");
            throw new TransactionAbortedException("Checkout could not be completed, please retry", e);
        }

        metricsService.recordCheckoutLatency(System.currentTimeMillis() - startTime);

        if (attempt.isRejected()) {
            logger.warn("Checkout rejected for user: {}, reason: {}, product: {}",
                    userId, attempt.rejectionReason, attempt.rejectedItem.getProductId());
            metricsService.recordCheckoutFailure(attempt.rejectionReason);
            throw attempt.rejectionException();
        }

        Order order = attempt.order;
        metricsService.recordCheckoutSuccess(order.getLineItems().size());
        metricsService.recordRevenue(order.getTotalAmount());
        logger.info("Created order: {} for user: {}, total: {}", order.getId(), userId, order.getTotalAmount());

        return new CheckoutReceipt(order.getId(), order.getTotalAmount(),
                order.getLineItems().size(), order.getCreatedAt());
    }

    /**
     * Run VALIDATING, PRICING and the writes of COMMITTING inside the open transaction.
     * Stops at the first rejection, leaving the attempt rejected.
     */
    private void execute(CheckoutAttempt attempt) {
        // VALIDATING
        Set<Long> productIds = attempt.items.stream()
                .map(CheckoutItem::getProductId)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<Long, Product> products = productRepository.findAllByIdForUpdate(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        // Stock still unclaimed by earlier items of this request
        Map<Long, Integer> remaining = new HashMap<>();
        for (CheckoutItem item : attempt.items) {
            Product product = products.get(item.getProductId());
            if (product == null) {
                attempt.reject(REASON_PRODUCT_NOT_FOUND, item);
                return;
            }
            int available = remaining.getOrDefault(product.getId(), product.getStock());
            if (available < item.getQuantity()) {
                attempt.reject(REASON_INSUFFICIENT_STOCK, item);
                return;
            }
            remaining.put(product.getId(), available - item.getQuantity());
        }

        // PRICING
        attempt.transitionTo(CheckoutState.PRICING);
        Order order = Order.builder()
                .userId(attempt.userId)
                .build();
        BigDecimal totalAmount = BigDecimal.ZERO;
        for (CheckoutItem item : attempt.items) {
            Product product = products.get(item.getProductId());
            OrderLineItem lineItem = OrderLineItem.builder()
                    .product(product)
                    .quantity(item.getQuantity())
                    .unitPrice(product.getPrice())
                    .build();
            order.addLineItem(lineItem);
            totalAmount = totalAmount.add(lineItem.getLineTotal());
        }
        order.setTotalAmount(totalAmount);

        // COMMITTING
        attempt.transitionTo(CheckoutState.COMMITTING);
        order = orderRepository.save(order);

        for (CheckoutItem item : attempt.items) {
            int updated = productRepository.decrementStock(item.getProductId(), item.getQuantity());
            if (updated == 0) {
                // Stock was taken by a transaction that committed after our read
                attempt.reject(REASON_INSUFFICIENT_STOCK, item);
                return;
            }
        }
        attempt.order = order;
    }

    private void validateRequest(Long userId, List<CheckoutItem> items) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("At least one item is required");
        }
        for (CheckoutItem item : items) {
            if (item == null || item.getProductId() == null) {
                throw new IllegalArgumentException("Product ID is required for every item");
            }
            if (item.getQuantity() == null || item.getQuantity() <= 0) {
                throw new IllegalArgumentException(
                        "Quantity must be positive for product " + item.getProductId());
            }
        }
    }

    /**
     * Mutable state of one checkout call. Never shared between threads.
     */
    private static final class CheckoutAttempt {

        private final Long userId;
        private final List<CheckoutItem> items;
        private CheckoutState state = CheckoutState.VALIDATING;
        private String rejectionReason;
        private CheckoutItem rejectedItem;
        private Order order;

        private CheckoutAttempt(Long userId, List<CheckoutItem> items) {
            this.userId = userId;
            this.items = items;
        }

        private void transitionTo(CheckoutState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal checkout transition " + state + " -> " + next);
            }
            logger.debug("Checkout for user {}: {} -> {}", userId, state, next);
            state = next;
        }

        private void reject(String reason, CheckoutItem item) {
            this.rejectionReason = reason;
            this.rejectedItem = item;
        }

        private boolean isRejected() {
            return rejectionReason != null;
        }

        private RuntimeException rejectionException() {
            if (REASON_PRODUCT_NOT_FOUND.equals(rejectionReason)) {
                return new ProductNotFoundException(rejectedItem.getProductId());
            }
            return new InsufficientStockException(rejectedItem.getProductId(), rejectedItem.getQuantity());
        }
    }
}
