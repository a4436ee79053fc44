package com.cred.freestyle.checkout.service;

import com.cred.freestyle.checkout.domain.model.Order;
import com.cred.freestyle.checkout.exception.ResourceNotFoundException;
import com.cred.freestyle.checkout.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only queries over the order ledger.
 *
 * @author Checkout Team
 */
@Service
@Transactional(readOnly = true)
public class OrderQueryService {

    private static final Logger logger = LoggerFactory.getLogger(OrderQueryService.class);

    private final OrderRepository orderRepository;

    public OrderQueryService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * Get all orders of a user, most recent first.
     *
     * @param userId User ID
     * @return List of orders
     */
    public List<Order> listOrders(Long userId) {
        logger.debug("Listing orders for user: {}", userId);
        return orderRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId);
    }

    /**
     * Get one order with its line items and their products.
     * An order owned by someone else is reported exactly like a missing one.
     *
     * @param userId Requesting user ID
     * @param orderId Order ID
     * @return Order with line items loaded
     * @throws ResourceNotFoundException if the order does not exist or is not owned by the user
     */
    public Order getOrderDetail(Long userId, Long orderId) {
        logger.debug("Fetching order: {} for user: {}", orderId, userId);
        return orderRepository.findDetailByIdAndUserId(orderId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", String.valueOf(orderId)));
    }
}
