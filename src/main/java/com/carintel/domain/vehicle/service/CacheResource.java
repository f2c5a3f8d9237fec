package com.carintel.domain.vehicle.service;

import java.time.Duration;
import java.util.Map;

/**
 * 카탈로그 캐시 이름과 TTL
 *
 * 캐시 이름이 Redis 키 접두어가 됨 (예: vehicles:makes:all)
 */
public final class CacheResource {

    public static final String YEARS = "vehicles:years";
    public static final String MAKES = "vehicles:makes";
    public static final String MODELS = "vehicles:models";
    public static final String TRIMS = "vehicles:trims";
    public static final String SEARCH = "vehicles:search";

    private static final Duration CATALOG_TTL = Duration.ofHours(24);
    private static final Duration SEARCH_TTL = Duration.ofHours(1);

    private static final Map<String, Duration> TTLS = Map.of(
            YEARS, CATALOG_TTL,
            MAKES, CATALOG_TTL,
            MODELS, CATALOG_TTL,
            TRIMS, CATALOG_TTL,
            SEARCH, SEARCH_TTL);

    private CacheResource() {
    }

    public static Map<String, Duration> ttls() {
        return TTLS;
    }
}
