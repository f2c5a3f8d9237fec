package com.carintel.domain.access.dto;

import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.UUID;

/**
 * validate_api_key_fast 함수 결과 행
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyValidation {

    private UUID apiKeyId;

    private UUID organizationId;

    private String orgName;

    private String tierId;

    /**
     * 분당 요청 한도 (키별 오버라이드 우선)
     */
    private Integer rateLimit;

    private Integer monthlyLimit;

    private Boolean isValid;

    /**
     * 거부 사유 (invalid_key, key_disabled, key_expired, subscription_inactive, quota_exceeded)
     */
    private String rejectionReason;
}
