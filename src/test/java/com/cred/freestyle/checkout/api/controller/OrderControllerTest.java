package com.cred.freestyle.checkout.api.controller;

import com.cred.freestyle.checkout.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.checkout.config.SecurityConfig;
import com.cred.freestyle.checkout.domain.model.Order;
import com.cred.freestyle.checkout.domain.model.Product;
import com.cred.freestyle.checkout.exception.InsufficientStockException;
import com.cred.freestyle.checkout.exception.InvalidCredentialException;
import com.cred.freestyle.checkout.exception.ProductNotFoundException;
import com.cred.freestyle.checkout.exception.ResourceNotFoundException;
import com.cred.freestyle.checkout.exception.TransactionAbortedException;
import com.cred.freestyle.checkout.security.AuthenticatedUser;
import com.cred.freestyle.checkout.security.CredentialService;
import com.cred.freestyle.checkout.service.CheckoutItem;
import com.cred.freestyle.checkout.service.CheckoutReceipt;
import com.cred.freestyle.checkout.service.CheckoutService;
import com.cred.freestyle.checkout.service.OrderQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.cred.freestyle.checkout.testutil.TestDataBuilder.aProduct;
import static com.cred.freestyle.checkout.testutil.TestDataBuilder.anOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for OrderController using MockMvc, with the real security chain in front.
 */
@WebMvcTest(OrderController.class)
@ContextConfiguration(classes = {OrderController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("OrderController Tests")
class OrderControllerTest {

    private static final String VALID_TOKEN = "Bearer valid-token";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CheckoutService checkoutService;

    @MockBean
    private OrderQueryService orderQueryService;

    @MockBean
    private CredentialService credentialService;

    @BeforeEach
    void setUp() {
        when(credentialService.verifyCredential("valid-token"))
                .thenReturn(new AuthenticatedUser(1L, "ada@example.com"));
        when(credentialService.verifyCredential("expired-token"))
                .thenThrow(new InvalidCredentialException("Invalid token", null));
    }

    // ========================================
    // POST /api/checkout Tests
    // ========================================

    @Test
    @DisplayName("POST /checkout - Valid request returns 201 Created")
    void checkout_ValidRequest_Returns201() throws Exception {
        // Given
        String requestBody = """
                {
                    "items": [
                        { "productId": 1, "quantity": 3 }
                    ]
                }
                """;
        when(checkoutService.checkout(eq(1L), anyList()))
                .thenReturn(new CheckoutReceipt(100L, new BigDecimal("30.00"), 1, Instant.now()));

        // When / Then
        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Order placed successfully"))
                .andExpect(jsonPath("$.orderId").value(100))
                .andExpect(jsonPath("$.totalAmount").value(30.00));
    }

    @Test
    @DisplayName("POST /checkout - Client-supplied price is ignored")
    void checkout_ClientPrice_IsIgnored() throws Exception {
        // Given
        String requestBody = """
                {
                    "items": [
                        { "productId": 1, "quantity": 2, "price": 0.01 }
                    ]
                }
                """;
        when(checkoutService.checkout(eq(1L), anyList()))
                .thenReturn(new CheckoutReceipt(101L, new BigDecimal("20.00"), 1, Instant.now()));

        // When / Then
        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalAmount").value(20.00));

        verify(checkoutService).checkout(eq(1L), argThat((List<CheckoutItem> items) ->
                items.size() == 1
                        && items.get(0).getProductId().equals(1L)
                        && items.get(0).getQuantity() == 2));
    }

    @Test
    @DisplayName("POST /checkout - Empty item list returns 400")
    void checkout_EmptyItems_Returns400() throws Exception {
        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.fieldErrors.items").exists());

        verify(checkoutService, never()).checkout(any(), any());
    }

    @Test
    @DisplayName("POST /checkout - Null item in the list returns 400")
    void checkout_NullItem_Returns400() throws Exception {
        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        verify(checkoutService, never()).checkout(any(), any());
    }

    @Test
    @DisplayName("POST /checkout - Non-positive quantity returns 400")
    void checkout_ZeroQuantity_Returns400() throws Exception {
        String requestBody = """
                {
                    "items": [
                        { "productId": 1, "quantity": 0 }
                    ]
                }
                """;

        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors['items[0].quantity']").value("Quantity must be positive"));

        verify(checkoutService, never()).checkout(any(), any());
    }

    @Test
    @DisplayName("POST /checkout - Malformed JSON returns 400")
    void checkout_MalformedBody_Returns400() throws Exception {
        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [ {"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /checkout - Unknown product returns 404")
    void checkout_ProductNotFound_Returns404() throws Exception {
        when(checkoutService.checkout(eq(1L), anyList())).thenThrow(new ProductNotFoundException(99L));

        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [ {\"productId\": 99, \"quantity\": 1} ]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Product Not Found"))
                .andExpect(jsonPath("$.details.productId").value(99));
    }

    @Test
    @DisplayName("POST /checkout - Insufficient stock returns 409")
    void checkout_InsufficientStock_Returns409() throws Exception {
        when(checkoutService.checkout(eq(1L), anyList())).thenThrow(new InsufficientStockException(1L, 3));

        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [ {\"productId\": 1, \"quantity\": 3} ]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Insufficient Stock"))
                .andExpect(jsonPath("$.details.requestedQuantity").value(3));
    }

    @Test
    @DisplayName("POST /checkout - Aborted transaction returns 500 without internal detail")
    void checkout_TransactionAborted_Returns500() throws Exception {
        when(checkoutService.checkout(eq(1L), anyList())).thenThrow(new TransactionAbortedException(
                "Checkout could not be completed, please retry", new CannotAcquireLockException("deadlock")));

        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", VALID_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [ {\"productId\": 1, \"quantity\": 1} ]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Transaction Aborted"))
                .andExpect(jsonPath("$.message").value("Checkout could not be completed, please retry"));
    }

    @Test
    @DisplayName("POST /checkout - Missing token returns 401")
    void checkout_NoToken_Returns401() throws Exception {
        mockMvc.perform(post("/api/checkout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [ {\"productId\": 1, \"quantity\": 1} ]}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Access token required"));

        verifyNoInteractions(checkoutService);
    }

    @Test
    @DisplayName("POST /checkout - Invalid token returns 403")
    void checkout_InvalidToken_Returns403() throws Exception {
        mockMvc.perform(post("/api/checkout")
                        .header("Authorization", "Bearer expired-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [ {\"productId\": 1, \"quantity\": 1} ]}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Invalid token"));

        verifyNoInteractions(checkoutService);
    }

    // ========================================
    // GET /api/orders Tests
    // ========================================

    @Test
    @DisplayName("GET /orders - Returns the caller's orders")
    void getOrders_ReturnsOrders() throws Exception {
        // Given
        Instant now = Instant.now();
        Order newer = anOrder().id(2L).userId(1L).createdAt(now)
                .item(aProduct().id(1L).price("10.00").build(), 1).build();
        Order older = anOrder().id(1L).userId(1L).createdAt(now.minus(1, ChronoUnit.DAYS))
                .item(aProduct().id(1L).price("10.00").build(), 3).build();
        when(orderQueryService.listOrders(1L)).thenReturn(List.of(newer, older));

        // When / Then
        mockMvc.perform(get("/api/orders").header("Authorization", VALID_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value(2))
                .andExpect(jsonPath("$[0].userId").value(1))
                .andExpect(jsonPath("$[1].totalAmount").value(30.00));
    }

    @Test
    @DisplayName("GET /orders - Missing token returns 401")
    void getOrders_NoToken_Returns401() throws Exception {
        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orderQueryService);
    }

    // ========================================
    // GET /api/orders/{id} Tests
    // ========================================

    @Test
    @DisplayName("GET /orders/{id} - Returns order with line items")
    void getOrder_ReturnsDetail() throws Exception {
        // Given
        Product widget = aProduct().id(1L).name("Widget").price("10.00").build();
        Order order = anOrder().id(5L).userId(1L).item(widget, 3).build();
        when(orderQueryService.getOrderDetail(1L, 5L)).thenReturn(order);

        // When / Then
        mockMvc.perform(get("/api/orders/5").header("Authorization", VALID_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.totalAmount").value(30.00))
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].name").value("Widget"))
                .andExpect(jsonPath("$.items[0].quantity").value(3))
                .andExpect(jsonPath("$.items[0].price").value(10.00));
    }

    @Test
    @DisplayName("GET /orders/{id} - Order not owned by caller returns 404")
    void getOrder_NotOwned_Returns404() throws Exception {
        when(orderQueryService.getOrderDetail(1L, 9L)).thenThrow(new ResourceNotFoundException("Order", "9"));

        mockMvc.perform(get("/api/orders/9").header("Authorization", VALID_TOKEN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Order not found"));
    }

    @Test
    @DisplayName("GET /orders/{id} - Non-numeric ID returns 400")
    void getOrder_NonNumericId_Returns400() throws Exception {
        mockMvc.perform(get("/api/orders/abc").header("Authorization", VALID_TOKEN))
                .andExpect(status().isBadRequest());
    }
}
