package com.carintel.domain.access.service;

import com.carintel.common.exception.BusinessException;
import com.carintel.common.exception.ErrorCode;
import com.carintel.config.VehicleApiProperties;
import com.carintel.domain.access.dto.ApiKeyPrincipal;
import com.carintel.domain.access.dto.ApiKeyValidation;
import com.carintel.domain.access.repository.ApiKeyRepository;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * API 키 인증 서비스
 *
 * X-API-Key 또는 Authorization: Bearer 헤더의 키를 SHA-256 해시로 검증
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyAuthService implements RequestAuthenticator {

    public static final String API_KEY_HEADER = "X-API-Key";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String QUOTA_EXCEEDED = "quota_exceeded";

    private final ApiKeyRepository apiKeyRepository;
    private final VehicleApiProperties properties;

    @Override
    public ApiKeyPrincipal authenticate(HttpServletRequest request) {
        String apiKey = extractApiKey(request);
        if (apiKey == null) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "API key is required");
        }

        ApiKeyValidation validation = apiKeyRepository.validateKey(sha256Hex(apiKey))
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED, "Invalid API key"));

        if (!Boolean.TRUE.equals(validation.getIsValid())) {
            String reason = validation.getRejectionReason();
            log.warn("API key rejected: keyId={}, reason={}", validation.getApiKeyId(), reason);

            if (QUOTA_EXCEEDED.equals(reason)) {
                throw new BusinessException(ErrorCode.QUOTA_EXCEEDED, "Monthly usage quota exceeded");
            }
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Invalid API key");
        }

        int rateLimit = validation.getRateLimit() != null && validation.getRateLimit() > 0
                ? validation.getRateLimit()
                : properties.getRateLimit().getDefaultPerMinute();

        return new ApiKeyPrincipal(validation.getApiKeyId(), validation.getOrganizationId(),
                validation.getOrgName(), validation.getTierId(), rateLimit);
    }

    private String extractApiKey(HttpServletRequest request) {
        String headerKey = request.getHeader(API_KEY_HEADER);
        if (StringUtils.hasText(headerKey)) {
            return headerKey.trim();
        }

        String authorization = request.getHeader("Authorization");
        if (StringUtils.hasText(authorization) && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
