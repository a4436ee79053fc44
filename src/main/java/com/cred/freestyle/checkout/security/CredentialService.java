package com.cred.freestyle.checkout.security;

import com.cred.freestyle.checkout.domain.model.UserAccount;
import com.cred.freestyle.checkout.exception.InvalidCredentialException;

/**
 * Issues and verifies the bearer credentials that protect checkout and order endpoints.
 *
 * @author Checkout Team
 */
public interface CredentialService {

    /**
     * Issue a signed, time-limited credential for the user.
     *
     * @param user Authenticated user account
     * @return Opaque token to be sent as {@code Authorization: Bearer <token>}
     */
    String issueCredential(UserAccount user);

    /**
     * Verify a credential and resolve the identity it carries.
     *
     * @param token Token presented by the client
     * @return Identity carried by the token
     * @throws InvalidCredentialException if the token is malformed, badly signed or expired
     */
    AuthenticatedUser verifyCredential(String token);
}
