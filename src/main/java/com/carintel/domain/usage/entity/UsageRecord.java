package com.carintel.domain.usage.entity;

import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * API 사용 로그 (usage_logs)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {

    private UUID apiKeyId;

    private UUID organizationId;

    private String endpoint;

    private String method;

    /**
     * 호출 출처 (X-Client-Source, 기본 "api")
     */
    private String source;

    private Map<String, Object> requestParams;

    private Integer responseStatus;

    private Long latencyMs;

    private String ipAddress;

    private String userAgent;
}
