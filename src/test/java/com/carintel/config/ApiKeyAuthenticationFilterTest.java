package com.carintel.config;

import com.carintel.common.exception.BusinessException;
import com.carintel.common.exception.ErrorCode;
import com.carintel.domain.access.dto.ApiKeyPrincipal;
import com.carintel.domain.access.dto.RateLimitDecision;
import com.carintel.domain.access.service.RateLimiter;
import com.carintel.domain.access.service.RequestAuthenticator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApiKeyAuthenticationFilterTest {

    private static final UUID ORG_ID = UUID.fromString("0b6a5a44-8a0e-4a4c-b0c8-6a3c1f2d9e10");

    @Mock
    private RequestAuthenticator requestAuthenticator;

    @Mock
    private RateLimiter rateLimiter;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ApiKeyAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ApiKeyAuthenticationFilter(requestAuthenticator, rateLimiter, objectMapper);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void shouldRejectMissingKeyWithErrorEnvelope() throws Exception {
        // Given
        when(requestAuthenticator.authenticate(any()))
                .thenThrow(new BusinessException(ErrorCode.UNAUTHORIZED, "API key is required"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(new MockHttpServletRequest("GET", "/vehicles/years"), response, chain);

        // Then
        assertEquals(401, response.getStatus());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("unauthorized", body.path("error").path("code").asText());
        assertEquals("API key is required", body.path("error").path("message").asText());
        assertNull(chain.getRequest());
        verifyNoInteractions(rateLimiter);
    }

    @Test
    void shouldRejectRateLimitedRequestWithRetryAfter() throws Exception {
        // Given
        when(requestAuthenticator.authenticate(any())).thenReturn(principal());
        when(rateLimiter.check(ORG_ID.toString(), 60)).thenReturn(RateLimitDecision.deny(60, 42));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/vehicles/years");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertEquals(429, response.getStatus());
        assertEquals("42", response.getHeader("Retry-After"));
        assertEquals("0", response.getHeader("X-RateLimit-Remaining"));
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("rate_limited", body.path("error").path("code").asText());
        assertNull(chain.getRequest());
        assertNotNull(request.getAttribute(ApiKeyPrincipal.REQUEST_ATTRIBUTE));
    }

    @Test
    void shouldRejectNonGetAfterAuthentication() throws Exception {
        // Given
        when(requestAuthenticator.authenticate(any())).thenReturn(principal());
        when(rateLimiter.check(ORG_ID.toString(), 60)).thenReturn(RateLimitDecision.allow(60, 59, 30));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(new MockHttpServletRequest("POST", "/vehicles/lookup"), response, chain);

        // Then
        assertEquals(405, response.getStatus());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("method_not_allowed", body.path("error").path("code").asText());
        assertNull(chain.getRequest());
    }

    @Test
    void shouldPassAuthenticatedGetAndPopulateSecurityContext() throws Exception {
        // Given
        ApiKeyPrincipal principal = principal();
        when(requestAuthenticator.authenticate(any())).thenReturn(principal);
        when(rateLimiter.check(ORG_ID.toString(), 60)).thenReturn(RateLimitDecision.allow(60, 59, 30));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(new MockHttpServletRequest("GET", "/vehicles/years"), response, chain);

        // Then
        assertNotNull(chain.getRequest());
        assertEquals("60", response.getHeader("X-RateLimit-Limit"));
        assertEquals("59", response.getHeader("X-RateLimit-Remaining"));
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertSame(principal, authentication.getPrincipal());
    }

    @Test
    void shouldSkipHealthEndpoint() throws Exception {
        // Given
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(new MockHttpServletRequest("GET", "/health"), new MockHttpServletResponse(), chain);

        // Then
        assertNotNull(chain.getRequest());
        verifyNoInteractions(requestAuthenticator, rateLimiter);
    }

    @Test
    void shouldSkipPathsUnderExcludedPrefix() throws Exception {
        // Given
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(new MockHttpServletRequest("GET", "/swagger-ui/index.html"),
                new MockHttpServletResponse(), chain);

        // Then
        assertNotNull(chain.getRequest());
        verifyNoInteractions(requestAuthenticator, rateLimiter);
    }

    @Test
    void shouldAuthenticatePathsThatOnlyShareExcludedPrefix() throws Exception {
        // Given
        when(requestAuthenticator.authenticate(any()))
                .thenThrow(new BusinessException(ErrorCode.UNAUTHORIZED, "API key is required"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(new MockHttpServletRequest("GET", "/healthz"), response, chain);

        // Then
        assertEquals(401, response.getStatus());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("unauthorized", body.path("error").path("code").asText());
        assertNull(chain.getRequest());
    }

    private static ApiKeyPrincipal principal() {
        return new ApiKeyPrincipal(UUID.randomUUID(), ORG_ID, "Acme Motors", "starter", 60);
    }
}
