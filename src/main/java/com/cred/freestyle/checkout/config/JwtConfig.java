package com.cred.freestyle.checkout.config;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Bearer token configuration.
 *
 * The signing secret is read once from {@code commerce.security.jwt.secret}
 * (environment variable {@code JWT_SECRET} in production) when the context starts
 * and turned into an immutable HMAC key. Startup fails if it is missing or
 * shorter than 256 bits, the minimum for HS256.
 *
 * @author Checkout Team
 */
@Configuration
public class JwtConfig {

    private static final Logger logger = LoggerFactory.getLogger(JwtConfig.class);

    static final int MIN_SECRET_BYTES = 32;

    @Value("${commerce.security.jwt.secret}")
    private String secret;

    @Bean
    public SecretKey jwtSigningKey() {
        return signingKey(secret);
    }

    @Bean
    public JwtEncoder jwtEncoder(SecretKey jwtSigningKey) {
        return new NimbusJwtEncoder(new ImmutableSecret<>(jwtSigningKey));
    }

    @Bean
    public JwtDecoder jwtDecoder(SecretKey jwtSigningKey) {
        return NimbusJwtDecoder.withSecretKey(jwtSigningKey)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Build the HS256 key from a configured secret.
     *
     * @param secret Raw secret
     * @return HMAC-SHA256 key
     * @throws IllegalStateException if the secret is blank or too short
     */
    static SecretKey signingKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("commerce.security.jwt.secret must be set");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "commerce.security.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        logger.info("Loaded JWT signing key ({} bytes)", bytes.length);
        return new SecretKeySpec(bytes, "HmacSHA256");
    }
}
