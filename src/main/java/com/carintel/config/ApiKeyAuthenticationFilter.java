package com.carintel.config;

import com.carintel.common.exception.BusinessException;
import com.carintel.common.exception.ErrorCode;
import com.carintel.common.util.ResponseUtils;
import com.carintel.domain.access.dto.ApiKeyPrincipal;
import com.carintel.domain.access.dto.RateLimitDecision;
import com.carintel.domain.access.service.RateLimiter;
import com.carintel.domain.access.service.RequestAuthenticator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * API 키 인증 필터
 *
 * 처리 순서: API 키 인증 -> 조직별 요청 한도 -> GET 메서드 확인
 * - 실패 시 컨트롤러까지 가지 않고 에러 응답을 바로 기록
 * - 인증 정보는 SecurityContext와 요청 속성에 설정
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    /**
     * 인증 제외 경로들
     */
    private static final List<String> EXCLUDED_PATHS = Arrays.asList(
        "/health",
        "/swagger-ui",
        "/v3/api-docs",
        "/api-docs",
        "/favicon.ico",
        "/error"
    );

    private final RequestAuthenticator requestAuthenticator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        ApiKeyPrincipal principal;
        try {
            principal = requestAuthenticator.authenticate(request);
        } catch (BusinessException e) {
            log.debug("Authentication failed: [{}] {}", e.getErrorCode().getCode(), e.getMessage());
            writeError(response, e.getErrorCode(), e.getMessage());
            return;
        }

        // 이후 거부되더라도 사용 로그는 남김
        request.setAttribute(ApiKeyPrincipal.REQUEST_ATTRIBUTE, principal);

        RateLimitDecision decision = rateLimiter.check(principal.getOrganizationId().toString(),
                principal.getRateLimitPerMinute());
        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.getRemaining()));
        if (!decision.isAllowed()) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
            writeError(response, ErrorCode.RATE_LIMITED, "Rate limit exceeded. Try again later.");
            return;
        }

        if (!HttpMethod.GET.matches(request.getMethod())) {
            writeError(response, ErrorCode.METHOD_NOT_ALLOWED, "Only GET requests are supported");
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal, null, Collections.singletonList(new SimpleGrantedAuthority("ROLE_API_CLIENT")));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    /**
     * 필터 적용 여부 결정
     * 제외 경로(정확히 일치하거나 그 하위 경로)는 필터링하지 않음
     */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());

        return EXCLUDED_PATHS.stream()
            .anyMatch(excluded -> path.equals(excluded) || path.startsWith(excluded + "/"));
    }

    private void writeError(HttpServletResponse response, ErrorCode errorCode, String message) throws IOException {
        response.setStatus(errorCode.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), ResponseUtils.error(errorCode, message));
    }
}
