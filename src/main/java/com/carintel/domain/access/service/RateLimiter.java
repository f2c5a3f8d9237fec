package com.carintel.domain.access.service;

import com.carintel.domain.access.dto.RateLimitDecision;

/**
 * 요청 한도 판정
 */
public interface RateLimiter {

    RateLimitDecision check(String subject, int limitPerMinute);
}
