package com.rediscache.config.redis;

import com.rediscache.cache.CacheOptions;
import com.rediscache.cache.CacheTemplate;
import com.rediscache.cache.DefaultCacheTemplate;
import com.rediscache.cache.codec.Codec;
import com.rediscache.cache.codec.Compressor;
import com.rediscache.cache.codec.GzipCompressor;
import com.rediscache.cache.codec.JacksonCodec;
import com.rediscache.cache.hook.CacheHook;
import com.rediscache.cache.metrics.InstrumentedCacheStore;
import com.rediscache.cache.metrics.MetricsHook;
import com.rediscache.cache.store.CacheStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * {@link CacheTemplate} 설정.
 * <p>
 * {@link CacheHook} 빈은 {@code @Order} 순서대로 등록되며, 먼저 등록된 훅이 바깥쪽에서 실행됩니다.
 * {@link MeterRegistry} 빈이 있고 {@code cache.metrics.enabled}가 true이면
 * 저장소 명령과 파이프라인 단계의 메트릭을 기록합니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheTemplateConfig {

    @Bean
    public CacheOptions cacheOptions(CacheProperties cacheProperties, ObjectProvider<CacheHook> hooks) {
        CacheOptions.CacheOptionsBuilder builder = CacheOptions.builder()
            .codec(codec(cacheProperties.codec()))
            .compressor(compressor(cacheProperties.compression()))
            .batchSize(cacheProperties.batchSize())
            .nearCacheTtl(cacheProperties.nearCacheTtl())
            .upsertMaxAttempts(cacheProperties.upsert().maxAttempts())
            .upsertBackoff(cacheProperties.upsert().backoff());
        hooks.orderedStream().forEach(builder::hook);
        return builder.build();
    }

    @Bean
    public CacheTemplate cacheTemplate(
        CacheStore cacheStore,
        CacheOptions cacheOptions,
        CacheProperties cacheProperties,
        ObjectProvider<MeterRegistry> meterRegistryProvider
    ) {
        MeterRegistry meterRegistry = cacheProperties.metrics().enabled()
            ? meterRegistryProvider.getIfAvailable()
            : null;
        if (meterRegistry == null) {
            log.info("캐시 템플릿 생성: 메트릭 비활성화. ({})", cacheOptions);
            return new DefaultCacheTemplate(cacheStore, cacheOptions);
        }

        log.info("캐시 템플릿 생성: 메트릭 활성화. ({})", cacheOptions);
        CacheOptions instrumented = cacheOptions.toBuilder()
            .hook(new MetricsHook(meterRegistry))
            .build();
        return new DefaultCacheTemplate(new InstrumentedCacheStore(cacheStore, meterRegistry), instrumented);
    }

    private static Codec codec(CacheProperties.CodecType type) {
        return switch (type) {
            case JSON -> JacksonCodec.json();
            case CBOR -> JacksonCodec.cbor();
        };
    }

    private static Compressor compressor(CacheProperties.CompressionType type) {
        return switch (type) {
            case NONE -> Compressor.none();
            case GZIP -> new GzipCompressor();
        };
    }
}
