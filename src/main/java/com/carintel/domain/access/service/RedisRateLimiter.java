package com.carintel.domain.access.service;

import com.carintel.domain.access.dto.RateLimitDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Redis 고정 윈도우(1분) 요청 한도
 *
 * Redis 장애 시 요청을 허용 (fail-open)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisRateLimiter implements RateLimiter {

    private static final long WINDOW_SECONDS = 60;

    private final RedisTemplate<String, String> redisTemplate;
    private final Clock clock;

    @Override
    public RateLimitDecision check(String subject, int limitPerMinute) {
        long epochSeconds = clock.millis() / 1000;
        long window = epochSeconds / WINDOW_SECONDS;
        long resetSeconds = WINDOW_SECONDS - (epochSeconds % WINDOW_SECONDS);
        String key = "ratelimit:" + subject + ":" + window;

        Long count;
        try {
            count = redisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                redisTemplate.expire(key, WINDOW_SECONDS, TimeUnit.SECONDS);
            }
        } catch (Exception e) {
            log.warn("Rate limit check failed, allowing request: subject={}, cause={}", subject, e.getMessage());
            return RateLimitDecision.allow(limitPerMinute, limitPerMinute, resetSeconds);
        }

        if (count == null) {
            return RateLimitDecision.allow(limitPerMinute, limitPerMinute, resetSeconds);
        }

        if (count > limitPerMinute) {
            log.info("Rate limit exceeded: subject={}, count={}, limit={}", subject, count, limitPerMinute);
            return RateLimitDecision.deny(limitPerMinute, resetSeconds);
        }
        return RateLimitDecision.allow(limitPerMinute, limitPerMinute - count, resetSeconds);
    }
}
