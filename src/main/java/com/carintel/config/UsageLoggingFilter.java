package com.carintel.config;

import com.carintel.domain.access.dto.ApiKeyPrincipal;
import com.carintel.domain.usage.entity.UsageRecord;
import com.carintel.domain.usage.service.UsageLogService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API 사용 로그 필터
 *
 * 인증된 요청만 기록하며(요청 한도 초과로 거절된 요청 제외),
 * 기록은 응답 이후 큐에 넣어 비동기로 저장
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsageLoggingFilter extends OncePerRequestFilter {

    static final String CLIENT_SOURCE_HEADER = "X-Client-Source";
    private static final String DEFAULT_SOURCE = "api";

    private final UsageLogService usageLogService;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        long startedAt = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            Object principal = request.getAttribute(ApiKeyPrincipal.REQUEST_ATTRIBUTE);
            if (principal instanceof ApiKeyPrincipal
                    && response.getStatus() != HttpStatus.TOO_MANY_REQUESTS.value()) {
                long latencyMs = (System.nanoTime() - startedAt) / 1_000_000;
                record(request, response, (ApiKeyPrincipal) principal, latencyMs);
            }
        }
    }

    private void record(HttpServletRequest request, HttpServletResponse response,
                        ApiKeyPrincipal principal, long latencyMs) {
        try {
            String source = request.getHeader(CLIENT_SOURCE_HEADER);

            usageLogService.enqueue(UsageRecord.builder()
                    .apiKeyId(principal.getApiKeyId())
                    .organizationId(principal.getOrganizationId())
                    .endpoint(resolveEndpoint(request))
                    .method(request.getMethod())
                    .source(StringUtils.hasText(source) ? source.trim() : DEFAULT_SOURCE)
                    .requestParams(requestParams(request))
                    .responseStatus(response.getStatus())
                    .latencyMs(latencyMs)
                    .ipAddress(clientIp(request))
                    .userAgent(request.getHeader("User-Agent"))
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to record usage for {}: {}", request.getRequestURI(), e.getMessage());
        }
    }

    /**
     * 매핑된 핸들러 패턴 (없으면 요청 URI)
     */
    private String resolveEndpoint(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : request.getRequestURI();
    }

    private Map<String, Object> requestParams(HttpServletRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values != null && values.length > 0) {
                params.put(name, values.length == 1 ? values[0] : values);
            }
        });
        return params;
    }

    /**
     * 클라이언트 IP (CF-Connecting-IP, X-Forwarded-For 첫 값, 원격 주소 순)
     */
    static String clientIp(HttpServletRequest request) {
        String cloudflareIp = request.getHeader("CF-Connecting-IP");
        if (StringUtils.hasText(cloudflareIp)) {
            return cloudflareIp.trim();
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwardedFor)) {
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
