package com.carintel.domain.vehicle.client;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * NHTSA vPIC VIN 디코더 설정
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "nhtsa.vpic")
public class NhtsaVpicConfig {

    /**
     * vPIC API 기본 URL
     */
    @NotBlank
    private String baseUrl = "https://vpic.nhtsa.dot.gov/api";

    /**
     * 연결 타임아웃 (밀리초)
     */
    @Min(1)
    private int connectTimeoutMs = 5000;

    /**
     * 응답 타임아웃 (밀리초)
     */
    @Min(1)
    private int readTimeoutMs = 10000;
}
