package com.cred.freestyle.checkout.security;

import com.cred.freestyle.checkout.domain.model.UserAccount;
import com.cred.freestyle.checkout.exception.InvalidCredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * HS256 JWT implementation of {@link CredentialService}.
 *
 * Token claims:
 * - sub: user ID
 * - id: user ID (numeric)
 * - email: user email
 * - iat / exp: issue time and issue time + lifetime
 *
 * @author Checkout Team
 */
@Service
public class JwtCredentialService implements CredentialService {

    private static final Logger logger = LoggerFactory.getLogger(JwtCredentialService.class);

    static final String CLAIM_USER_ID = "id";
    static final String CLAIM_EMAIL = "email";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final Clock clock;
    private final Duration credentialLifetime;

    public JwtCredentialService(
            JwtEncoder jwtEncoder,
            JwtDecoder jwtDecoder,
            Clock clock,
            @Value("${commerce.security.jwt.ttl:PT1H}") Duration credentialLifetime
    ) {
        this.jwtEncoder = jwtEncoder;
        this.jwtDecoder = jwtDecoder;
        this.clock = clock;
        this.credentialLifetime = credentialLifetime;
    }

    @Override
    public String issueCredential(UserAccount user) {
        Instant now = clock.instant();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject(String.valueOf(user.getId()))
                .claim(CLAIM_USER_ID, user.getId())
                .claim(CLAIM_EMAIL, user.getEmail())
                .issuedAt(now)
                .expiresAt(now.plus(credentialLifetime))
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();

        String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        logger.debug("Issued credential for user: {}, expires at: {}", user.getId(), claims.getExpiresAt());
        return token;
    }

    @Override
    public AuthenticatedUser verifyCredential(String token) {
        try {
            Jwt jwt = jwtDecoder.decode(token);
            Long userId = Long.valueOf(jwt.getSubject());
            return new AuthenticatedUser(userId, jwt.getClaimAsString(CLAIM_EMAIL));
        } catch (JwtException | NumberFormatException e) {
            logger.debug("Rejected credential: {}", e.getMessage());
            throw new InvalidCredentialException("Invalid token", e);
        }
    }
}
