package com.rediscache.config.redis;

import com.github.benmanes.caffeine.cache.Cache;
import com.rediscache.cache.redis.RedisCacheStore;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Configuration;

/**
 * near-cache(Caffeine) 통계를 Micrometer로 노출하기 위한 수동 바인딩 설정.
 *
 * - 엔트리 수(cache.near.size)
 * - 누적 히트/미스(cache.near.hits, cache.near.misses)
 * - 누적 제거 수(cache.near.evictions)
 */
@Configuration
public class NearCacheMetricsConfig {

    private final RedisCacheStore redisCacheStore;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;
    private final CacheProperties cacheProperties;

    public NearCacheMetricsConfig(
        RedisCacheStore redisCacheStore,
        ObjectProvider<MeterRegistry> meterRegistryProvider,
        CacheProperties cacheProperties
    ) {
        this.redisCacheStore = redisCacheStore;
        this.meterRegistryProvider = meterRegistryProvider;
        this.cacheProperties = cacheProperties;
    }

    @PostConstruct
    public void bindNearCacheToMetrics() {
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
        if (meterRegistry == null || !cacheProperties.metrics().enabled()) {
            return;
        }

        Cache<String, ?> nearCache = redisCacheStore.nearCache();
        Tags tags = Tags.of("cache", "near");

        Gauge.builder("cache.near.size", nearCache, c -> c.estimatedSize())
            .tags(tags)
            .register(meterRegistry);

        FunctionCounter.builder("cache.near.hits", nearCache, c -> c.stats().hitCount())
            .tags(tags)
            .register(meterRegistry);

        FunctionCounter.builder("cache.near.misses", nearCache, c -> c.stats().missCount())
            .tags(tags)
            .register(meterRegistry);

        FunctionCounter.builder("cache.near.evictions", nearCache, c -> c.stats().evictionCount())
            .tags(tags)
            .register(meterRegistry);
    }
}
