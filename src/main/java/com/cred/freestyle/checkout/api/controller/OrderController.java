package com.cred.freestyle.checkout.api.controller;

import com.cred.freestyle.checkout.api.dto.CheckoutRequest;
import com.cred.freestyle.checkout.api.dto.CheckoutResponse;
import com.cred.freestyle.checkout.api.dto.OrderDetailResponse;
import com.cred.freestyle.checkout.api.dto.OrderResponse;
import com.cred.freestyle.checkout.security.SecurityUtils;
import com.cred.freestyle.checkout.service.CheckoutItem;
import com.cred.freestyle.checkout.service.CheckoutReceipt;
import com.cred.freestyle.checkout.service.CheckoutService;
import com.cred.freestyle.checkout.service.OrderQueryService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for checkout and order history.
 * Every endpoint acts on behalf of the authenticated caller; the user ID never
 * comes from the request body or path.
 *
 * @author Checkout Team
 */
@RestController
@RequestMapping("/api")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final CheckoutService checkoutService;
    private final OrderQueryService orderQueryService;

    public OrderController(CheckoutService checkoutService, OrderQueryService orderQueryService) {
        this.checkoutService = checkoutService;
        this.orderQueryService = orderQueryService;
    }

    /**
     * Place an order for the caller.
     * Prices come from the catalog; any price in the request body is ignored.
     *
     * @param request Items to buy
     * @return 201 with the order ID and total
     */
    @PostMapping("/checkout")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CheckoutResponse> checkout(@Valid @RequestBody CheckoutRequest request) {
        Long userId = SecurityUtils.requireCurrentUserId();
        logger.info("Processing checkout for user: {}, items: {}", userId, request.getItems().size());

        List<CheckoutItem> items = request.getItems().stream()
                .map(item -> new CheckoutItem(item.getProductId(), item.getQuantity()))
                .collect(Collectors.toList());

        CheckoutReceipt receipt = checkoutService.checkout(userId, items);

        return ResponseEntity.status(HttpStatus.CREATED).body(CheckoutResponse.fromReceipt(receipt));
    }

    /**
     * List the caller's orders, newest first.
     *
     * @return Order summaries
     */
    @GetMapping("/orders")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<OrderResponse>> getOrders() {
        Long userId = SecurityUtils.requireCurrentUserId();
        logger.debug("Fetching orders for user: {}", userId);

        List<OrderResponse> orders = orderQueryService.listOrders(userId).stream()
                .map(OrderResponse::fromEntity)
                .collect(Collectors.toList());

        return ResponseEntity.ok(orders);
    }

    /**
     * Get one of the caller's orders with its line items.
     * Orders of other users are reported as not found.
     *
     * @param id Order ID
     * @return Order detail
     */
    @GetMapping("/orders/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderDetailResponse> getOrder(@PathVariable Long id) {
        Long userId = SecurityUtils.requireCurrentUserId();
        logger.debug("Fetching order: {} for user: {}", id, userId);

        return ResponseEntity.ok(OrderDetailResponse.fromEntity(orderQueryService.getOrderDetail(userId, id)));
    }
}
