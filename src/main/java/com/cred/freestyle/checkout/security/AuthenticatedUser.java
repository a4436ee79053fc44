package com.cred.freestyle.checkout.security;

/**
 * Identity carried by a verified bearer token. Used as the Spring Security principal.
 *
 * @author Checkout Team
 */
public final class AuthenticatedUser {

    private final Long userId;
    private final String email;

    public AuthenticatedUser(Long userId, String email) {
        this.userId = userId;
        this.email = email;
    }

    public Long getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    @Override
    public String toString() {
        return "AuthenticatedUser{userId=" + userId + ", email=" + email + "}";
    }
}
