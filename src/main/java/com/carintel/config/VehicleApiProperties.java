package com.carintel.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * 차량 API 동작 설정
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "carintel")
public class VehicleApiProperties {

    @Valid
    private final Lookup lookup = new Lookup();

    @Valid
    private final MarketValue marketValue = new MarketValue();

    @Valid
    private final Usage usage = new Usage();

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    /**
     * 보증/시세/정비 병렬 조회 스레드풀
     */
    @Getter
    @Setter
    public static class Lookup {
        @Min(1)
        private int corePoolSize = 8;
        @Min(1)
        private int maxPoolSize = 32;
        @Min(1)
        private int queueCapacity = 200;
    }

    /**
     * 주행거리 보정 기준
     */
    @Getter
    @Setter
    public static class MarketValue {
        /**
         * 연간 기대 주행거리 (마일)
         */
        @Min(1)
        private int milesPerYear = 12000;

        /**
         * 기대치 대비 1마일당 보정 금액 (센트)
         */
        @Min(0)
        private int centsPerMile = 10;
    }

    /**
     * 사용량 로그 큐
     */
    @Getter
    @Setter
    public static class Usage {
        @Min(1)
        private int queueCapacity = 10000;
        @Min(1)
        private int batchSize = 500;
        @Min(1)
        private long flushIntervalMs = 1000;
    }

    @Getter
    @Setter
    public static class RateLimit {
        /**
         * 요청 한도가 지정되지 않은 키의 분당 기본 한도
         */
        @Min(1)
        private int defaultPerMinute = 60;
    }
}
