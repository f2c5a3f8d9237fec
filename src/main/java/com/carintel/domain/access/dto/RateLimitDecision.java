package com.carintel.domain.access.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 요청 한도 판정 결과
 */
@Getter
@AllArgsConstructor
public class RateLimitDecision {

    private final boolean allowed;

    private final long limit;

    private final long remaining;

    /**
     * 현재 윈도우 종료까지 남은 초
     */
    private final long retryAfterSeconds;

    public static RateLimitDecision allow(long limit, long remaining, long resetSeconds) {
        return new RateLimitDecision(true, limit, remaining, resetSeconds);
    }

    public static RateLimitDecision deny(long limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, retryAfterSeconds);
    }
}
