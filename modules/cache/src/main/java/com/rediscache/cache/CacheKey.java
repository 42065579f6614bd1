package com.rediscache.cache;

import com.rediscache.support.error.CacheErrorType;
import com.rediscache.support.error.CacheException;

import java.time.Duration;

/**
 * 캐시 키.
 * <p>
 * 키 문자열, TTL, 값 타입을 함께 묶어 호출부에서 반복되는 인자를 줄입니다.
 * TTL이 {@link Duration#ZERO}이면 만료되지 않습니다.
 * </p>
 *
 * @param key 캐시 키 문자열
 * @param ttl TTL
 * @param type 캐시 값의 타입 (역직렬화 시 사용)
 * @param <T> 캐시 값의 타입
 * @author Loopers
 * @version 1.0
 */
public record CacheKey<T>(
    String key,
    Duration ttl,
    Class<T> type
) {

    public CacheKey {
        if (key == null || key.isEmpty()) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "캐시 키는 비어 있을 수 없습니다.");
        }
        if (type == null) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "캐시 값 타입은 필수입니다. (key: " + key + ")");
        }
        ttl = ttl != null ? ttl : Duration.ZERO;
        if (ttl.isNegative()) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "TTL은 음수일 수 없습니다. (key: " + key + ")");
        }
    }

    /**
     * 만료되지 않는 캐시 키를 생성합니다.
     *
     * @param key 캐시 키 문자열
     * @param type 캐시 값의 타입
     * @param <T> 캐시 값의 타입
     * @return 캐시 키
     */
    public static <T> CacheKey<T> of(String key, Class<T> type) {
        return new CacheKey<>(key, Duration.ZERO, type);
    }

    /**
     * 캐시 키를 생성합니다.
     *
     * @param key 캐시 키 문자열
     * @param ttl TTL
     * @param type 캐시 값의 타입
     * @param <T> 캐시 값의 타입
     * @return 캐시 키
     */
    public static <T> CacheKey<T> of(String key, Duration ttl, Class<T> type) {
        return new CacheKey<>(key, ttl, type);
    }

    public CacheKey<T> withTtl(Duration ttl) {
        return new CacheKey<>(key, ttl, type);
    }
}
