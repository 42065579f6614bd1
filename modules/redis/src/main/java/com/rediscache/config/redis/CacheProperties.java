package com.rediscache.config.redis;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 캐시 템플릿 설정.
 *
 * @param codec 값 인코딩 방식
 * @param compression 압축 방식
 * @param batchSize 다중 조회/저장 묶음 크기 (0이면 한 번에)
 * @param nearCacheTtl near-cache 유지 시간 (0이면 사용 안 함)
 * @param nearCacheMaxSize near-cache 최대 엔트리 수
 * @param upsert Upsert 재시도 설정
 * @param metrics 메트릭 설정
 */
@ConfigurationProperties(value = "cache")
public record CacheProperties(
    @DefaultValue("json") CodecType codec,
    @DefaultValue("none") CompressionType compression,
    @DefaultValue("0") int batchSize,
    @DefaultValue("0s") Duration nearCacheTtl,
    @DefaultValue("10000") long nearCacheMaxSize,
    @DefaultValue Upsert upsert,
    @DefaultValue Metrics metrics
) {

    public enum CodecType {
        JSON,
        CBOR
    }

    public enum CompressionType {
        NONE,
        GZIP
    }

    public record Upsert(
        @DefaultValue("1") int maxAttempts,
        @DefaultValue("10ms") Duration backoff
    ) {
    }

    public record Metrics(
        @DefaultValue("true") boolean enabled
    ) {
    }
}
