package com.cred.freestyle.checkout.service;

import com.cred.freestyle.checkout.domain.model.UserAccount;
import com.cred.freestyle.checkout.exception.EmailAlreadyRegisteredException;
import com.cred.freestyle.checkout.exception.InvalidLoginException;
import com.cred.freestyle.checkout.infrastructure.metrics.CommerceMetricsService;
import com.cred.freestyle.checkout.repository.UserAccountRepository;
import com.cred.freestyle.checkout.security.CredentialService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for user registration and login.
 *
 * @author Checkout Team
 */
@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final CredentialService credentialService;
    private final CommerceMetricsService metricsService;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordEncoder passwordEncoder,
            CredentialService credentialService,
            CommerceMetricsService metricsService
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
        this.credentialService = credentialService;
        this.metricsService = metricsService;
    }

    /**
     * Register a new user.
     *
     * @param name Display name
     * @param email Email, unique across users
     * @param password Raw password, stored only as a BCrypt hash
     * @return Created user
     * @throws EmailAlreadyRegisteredException if the email is taken
     */
    @Transactional
    public UserAccount signup(String name, String email, String password) {
        logger.info("Registering user with email: {}", email);

        if (userAccountRepository.existsByEmail(email)) {
            metricsService.recordSignup(false);
            throw new EmailAlreadyRegisteredException(email);
        }

        UserAccount user = UserAccount.builder()
                .name(name)
                .email(email)
                .passwordHash(passwordEncoder.encode(password))
                .build();

        try {
            // saveAndFlush so a concurrent signup with the same email fails here, on the unique index
            user = userAccountRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            metricsService.recordSignup(false);
            throw new EmailAlreadyRegisteredException(email);
        }

        metricsService.recordSignup(true);
        logger.info("Registered user: {}", user.getId());
        return user;
    }

    /**
     * Check a user's password and issue a bearer token.
     *
     * @param email Email
     * @param password Raw password
     * @return Token and the logged-in user
     * @throws InvalidLoginException if the user is unknown or the password does not match
     */
    @Transactional(readOnly = true)
    public LoginResult login(String email, String password) {
        UserAccount user = userAccountRepository.findByEmail(email)
                .orElseThrow(() -> {
                    logger.warn("Login failed, unknown email: {}", email);
                    metricsService.recordLogin(false);
                    return new InvalidLoginException("User not found");
                });

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            logger.warn("Login failed, bad password for user: {}", user.getId());
            metricsService.recordLogin(false);
            throw new InvalidLoginException("Invalid password");
        }

        String token = credentialService.issueCredential(user);
        metricsService.recordLogin(true);
        logger.info("User logged in: {}", user.getId());
        return new LoginResult(token, user);
    }

    /**
     * Token plus the user it was issued to.
     */
    public static class LoginResult {
        private final String token;
        private final UserAccount user;

        public LoginResult(String token, UserAccount user) {
            this.token = token;
            this.user = user;
        }

        public String getToken() { return token; }
        public UserAccount getUser() { return user; }
    }
}
