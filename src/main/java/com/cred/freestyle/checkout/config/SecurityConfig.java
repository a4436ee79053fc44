package com.cred.freestyle.checkout.config;

import com.cred.freestyle.checkout.security.CredentialService;
import com.cred.freestyle.checkout.security.JwtAuthenticationFilter;
import com.cred.freestyle.checkout.security.RestAuthenticationEntryPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for the checkout service.
 *
 * Authentication Strategy:
 * - Bearer JWT in the Authorization header, verified by {@link JwtAuthenticationFilter}
 * - Stateless session management (no server-side sessions)
 *
 * Authorization:
 * - Method-level security using @PreAuthorize annotations
 * - Users only ever see their own orders (enforced in the query layer)
 *
 * Public Endpoints (no authentication required):
 * - /actuator/health, /actuator/info, /actuator/metrics/**
 * - POST /api/signup, POST /api/login
 * - GET /api/products/**
 *
 * @author Checkout Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    private static final int BCRYPT_STRENGTH = 10;

    /**
     * Configure HTTP security.
     *
     * The JWT filter is built here rather than exposed as a bean, so the servlet
     * container does not register it a second time outside the security chain.
     */
    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            CredentialService credentialService,
            ObjectMapper objectMapper
    ) throws Exception {
        http
            // Disable CSRF for stateless REST API
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health", "/actuator/info", "/actuator/metrics/**").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/signup", "/api/login").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/products", "/api/products/**").permitAll()
                .requestMatchers("/error").permitAll()

                // All other endpoints require authentication
                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new RestAuthenticationEntryPoint(objectMapper))
            )

            .addFilterBefore(
                new JwtAuthenticationFilter(credentialService),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }
}
