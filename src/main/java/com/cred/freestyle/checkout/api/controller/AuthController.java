package com.cred.freestyle.checkout.api.controller;

import com.cred.freestyle.checkout.api.dto.LoginRequest;
import com.cred.freestyle.checkout.api.dto.LoginResponse;
import com.cred.freestyle.checkout.api.dto.SignupRequest;
import com.cred.freestyle.checkout.api.dto.SignupResponse;
import com.cred.freestyle.checkout.api.dto.UserResponse;
import com.cred.freestyle.checkout.domain.model.UserAccount;
import com.cred.freestyle.checkout.service.AuthService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for signup and login. Both endpoints are public.
 *
 * @author Checkout Team
 */
@RestController
@RequestMapping("/api")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * Register a new user.
     *
     * @param request Name, email and password
     * @return 201 with the new user's ID
     */
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        logger.debug("Signup request for email: {}", request.getEmail());

        UserAccount user = authService.signup(request.getName(), request.getEmail(), request.getPassword());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new SignupResponse("User created successfully", user.getId()));
    }

    /**
     * Log in with email and password.
     *
     * @param request Email and password
     * @return Bearer token and the user's public profile
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        logger.debug("Login request for email: {}", request.getEmail());

        AuthService.LoginResult result = authService.login(request.getEmail(), request.getPassword());

        return ResponseEntity.ok(new LoginResponse(result.getToken(), UserResponse.fromEntity(result.getUser())));
    }
}
