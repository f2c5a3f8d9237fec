package com.carintel.common.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 헬스체크 API 컨트롤러 (인증 불필요)
 */
@RestController
@Tag(name = "Health", description = "헬스체크 API")
public class HealthController {

    @Value("${spring.application.name:carintel-vehicle-api}")
    private String appName;

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Operation(summary = "시스템 상태 확인", description = "애플리케이션 기동 여부를 반환합니다.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("application", appName);
        response.put("version", appVersion);
        response.put("timestamp", OffsetDateTime.now().toString());

        return ResponseEntity.ok(response);
    }
}
