package com.cred.freestyle.checkout.security;

import com.cred.freestyle.checkout.api.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;

/**
 * Writes the standard error body when a protected endpoint is called without valid credentials.
 * 401 when no token was sent, 403 when a token was sent but rejected.
 *
 * @author Checkout Team
 */
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Logger logger = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException
    ) throws IOException {
        boolean invalidToken = request.getAttribute(JwtAuthenticationFilter.INVALID_CREDENTIAL_ATTRIBUTE) != null;

        HttpStatus status = invalidToken ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED;
        String message = invalidToken ? "Invalid token" : "Access token required";
        logger.warn("Rejected unauthenticated request to {}: {}", request.getRequestURI(), message);

        ErrorResponse error = new ErrorResponse(
                status.value(),
                "Invalid Credential",
                message,
                request.getRequestURI()
        );

        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
