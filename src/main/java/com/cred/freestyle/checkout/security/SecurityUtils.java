package com.cred.freestyle.checkout.security;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Utility class for reading the authenticated caller.
 *
 * @author Checkout Team
 */
public class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user.
     *
     * @return User from authentication context, or null if not authenticated
     */
    public static AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof AuthenticatedUser) {
                return (AuthenticatedUser) principal;
            }
        }

        return null;
    }

    /**
     * Get the ID of the currently authenticated user.
     *
     * @return User ID
     * @throws AuthenticationCredentialsNotFoundException if nobody is authenticated
     */
    public static Long requireCurrentUserId() {
        AuthenticatedUser user = getCurrentUser();
        if (user == null) {
            throw new AuthenticationCredentialsNotFoundException("User not authenticated");
        }
        return user.getUserId();
    }
}
