package com.cred.freestyle.checkout.security;

import com.cred.freestyle.checkout.exception.InvalidCredentialException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Authentication filter that verifies the {@code Authorization: Bearer <token>} header.
 *
 * - No header: the request continues unauthenticated
 * - Valid token: an authentication carrying {@link AuthenticatedUser} is put in the SecurityContext
 * - Invalid or expired token: the request continues unauthenticated and is flagged,
 *   so that protected endpoints answer 403 instead of 401
 *
 * @author Checkout Team
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String INVALID_CREDENTIAL_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".INVALID";

    private static final String BEARER_PREFIX = "Bearer ";

    private final CredentialService credentialService;

    public JwtAuthenticationFilter(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            try {
                AuthenticatedUser user = credentialService.verifyCredential(token);

                List<SimpleGrantedAuthority> authorities = Collections.singletonList(
                    new SimpleGrantedAuthority("ROLE_USER")
                );
                UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(user, null, authorities);
                SecurityContextHolder.getContext().setAuthentication(authentication);

                logger.debug("Authenticated user: {}", user.getUserId());
            } catch (InvalidCredentialException e) {
                SecurityContextHolder.clearContext();
                request.setAttribute(INVALID_CREDENTIAL_ATTRIBUTE, Boolean.TRUE);
                logger.debug("Invalid bearer token on {}", request.getRequestURI());
            }
        } else {
            logger.debug("No bearer token found, request will be unauthenticated");
        }

        filterChain.doFilter(request, response);
    }
}
