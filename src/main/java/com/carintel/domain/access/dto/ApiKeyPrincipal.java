package com.carintel.domain.access.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * API 키 인증 주체
 */
@Getter
@ToString
@AllArgsConstructor
public class ApiKeyPrincipal {

    /**
     * 요청 속성 이름
     */
    public static final String REQUEST_ATTRIBUTE = ApiKeyPrincipal.class.getName();

    private final UUID apiKeyId;

    private final UUID organizationId;

    private final String orgName;

    private final String tierId;

    private final int rateLimitPerMinute;
}
