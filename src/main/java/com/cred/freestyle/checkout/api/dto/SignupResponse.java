package com.cred.freestyle.checkout.api.dto;

/**
 * Response DTO for user registration.
 *
 * @author Checkout Team
 */
public class SignupResponse {

    private String message;
    private Long userId;

    public SignupResponse() {
    }

    public SignupResponse(String message, Long userId) {
        this.message = message;
        this.userId = userId;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }
}
