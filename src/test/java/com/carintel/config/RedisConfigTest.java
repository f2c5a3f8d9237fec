package com.carintel.config;

import com.carintel.domain.vehicle.service.CacheResource;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RedisConfigTest {

    @Test
    void shouldConfigureTtlAndKeyPrefixPerCache() {
        // Given
        RedisCacheManager cacheManager = new RedisConfig().cacheManager(mock(RedisConnectionFactory.class));
        cacheManager.afterPropertiesSet();

        // When
        Map<String, RedisCacheConfiguration> configurations = cacheManager.getCacheConfigurations();

        // Then
        assertEquals(Duration.ofHours(24), configurations.get(CacheResource.YEARS).getTtl());
        assertEquals(Duration.ofHours(24), configurations.get(CacheResource.TRIMS).getTtl());
        assertEquals(Duration.ofHours(1), configurations.get(CacheResource.SEARCH).getTtl());
        assertEquals("vehicles:makes:", configurations.get(CacheResource.MAKES).getKeyPrefixFor(CacheResource.MAKES));
        assertFalse(configurations.get(CacheResource.MODELS).getAllowCacheNullValues());
    }

    @Test
    void shouldLogCacheErrorsInsteadOfThrowing() {
        // Given
        RedisConfig config = new RedisConfig();

        // When / Then
        assertInstanceOf(LoggingCacheErrorHandler.class, config.errorHandler());
        assertDoesNotThrow(() -> config.errorHandler().handleCacheGetError(
                new IllegalStateException("timeout"), mock(org.springframework.cache.Cache.class), "all"));
    }
}
