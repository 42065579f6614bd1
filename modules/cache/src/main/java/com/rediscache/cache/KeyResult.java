package com.rediscache.cache;

import com.rediscache.support.error.CacheException;

/**
 * 다중 조회에서 키 하나의 결과.
 *
 * @param key 키
 * @param status 결과 상태
 * @param value 디코딩된 값 ({@link Status#FOUND}일 때만)
 * @param error 디코딩 오류 ({@link Status#DECODE_ERROR}일 때만)
 * @param <T> 값 타입
 * @author Loopers
 * @version 1.0
 */
public record KeyResult<T>(
    String key,
    Status status,
    T value,
    CacheException error
) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        DECODE_ERROR
    }

    public static <T> KeyResult<T> found(String key, T value) {
        return new KeyResult<>(key, Status.FOUND, value, null);
    }

    public static <T> KeyResult<T> notFound(String key) {
        return new KeyResult<>(key, Status.NOT_FOUND, null, null);
    }

    public static <T> KeyResult<T> decodeError(String key, CacheException error) {
        return new KeyResult<>(key, Status.DECODE_ERROR, null, error);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
