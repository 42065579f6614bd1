package com.rediscache.config.redis;

import com.rediscache.cache.redis.RedisCacheStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NearCacheMetricsConfigTest {

    @Configuration
    @EnableConfigurationProperties(CacheProperties.class)
    static class PropertiesConfig {
    }

    @DisplayName("near-cache 적중, 미적중, 크기가 메트릭으로 노출된다.")
    @Test
    @SuppressWarnings("unchecked")
    void bindsNearCacheStatistics() {
        // arrange
        RedisTemplate<String, byte[]> readTemplate = mock(RedisTemplate.class);
        ValueOperations<String, byte[]> readOps = mock(ValueOperations.class);
        when(readTemplate.opsForValue()).thenReturn(readOps);
        when(readOps.get("person")).thenReturn("{}".getBytes(StandardCharsets.UTF_8));
        RedisCacheStore store = new RedisCacheStore(readTemplate, mock(RedisTemplate.class), 100);

        new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class, NearCacheMetricsConfig.class)
            .withBean(RedisCacheStore.class, () -> store)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> {
                MeterRegistry meterRegistry = context.getBean(MeterRegistry.class);

                // act
                store.getCached("person", Duration.ofMinutes(1));
                store.getCached("person", Duration.ofMinutes(1));

                // assert
                assertThat(meterRegistry.get("cache.near.hits").functionCounter().count()).isEqualTo(1.0);
                assertThat(meterRegistry.get("cache.near.misses").functionCounter().count()).isEqualTo(1.0);
                assertThat(meterRegistry.get("cache.near.size").gauge().value()).isEqualTo(1.0);
            });
    }
}
