package com.cred.freestyle.checkout.security;

import com.cred.freestyle.checkout.exception.InvalidCredentialException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JwtAuthenticationFilter.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JwtAuthenticationFilter Tests")
class JwtAuthenticationFilterTest {

    @Mock
    private CredentialService credentialService;

    private JwtAuthenticationFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;
    private MockFilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(credentialService);
        request = new MockHttpServletRequest("GET", "/api/orders");
        response = new MockHttpServletResponse();
        chain = new MockFilterChain();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Valid bearer token - Authenticates the user and continues the chain")
    void validToken_Authenticates() throws Exception {
        // Given
        request.addHeader("Authorization", "Bearer good-token");
        when(credentialService.verifyCredential("good-token"))
                .thenReturn(new AuthenticatedUser(7L, "ada@example.com"));

        // When
        filter.doFilter(request, response, chain);

        // Then
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isInstanceOf(AuthenticatedUser.class);
        assertThat(SecurityUtils.requireCurrentUserId()).isEqualTo(7L);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("No Authorization header - Continues unauthenticated")
    void noHeader_ContinuesUnauthenticated() throws Exception {
        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.INVALID_CREDENTIAL_ATTRIBUTE)).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
        verify(credentialService, never()).verifyCredential(anyString());
    }

    @Test
    @DisplayName("Invalid bearer token - Continues unauthenticated and flags the request")
    void invalidToken_FlagsRequest() throws Exception {
        // Given
        request.addHeader("Authorization", "Bearer bad-token");
        when(credentialService.verifyCredential("bad-token"))
                .thenThrow(new InvalidCredentialException("Invalid token", null));

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.INVALID_CREDENTIAL_ATTRIBUTE)).isEqualTo(Boolean.TRUE);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("Non-bearer scheme - Ignored")
    void basicScheme_Ignored() throws Exception {
        request.addHeader("Authorization", "Basic dXNlcjpwYXNz");

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verifyNoInteractions(credentialService);
    }
}
