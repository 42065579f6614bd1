package com.rediscache.cache;

import com.rediscache.cache.hook.CacheHook;
import com.rediscache.support.error.CacheErrorType;
import com.rediscache.support.error.CacheException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 캐시 템플릿 인터페이스.
 * <p>
 * 값의 인코딩/압축과 저장소 요청을 묶어 조회, 저장, 삭제, 다중 조회, 원자적 갱신(Upsert) 기능을 제공합니다.
 * 모든 오류는 {@link CacheException}으로 전달되며 {@link CacheErrorType}으로 분류됩니다.
 * </p>
 * <p>
 * 여러 스레드에서 동시에 사용해도 안전합니다.
 * 호출 스레드가 인터럽트되면 {@link CacheErrorType#CANCELLED}로 실패합니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public interface CacheTemplate {

    /**
     * 캐시에서 값을 조회합니다.
     *
     * @param key 캐시 키
     * @param type 값 타입
     * @param <T> 값 타입
     * @return 캐시 값
     * @throws CacheException 키가 없으면 {@link CacheErrorType#KEY_NOT_FOUND}
     */
    <T> T get(String key, Class<T> type);

    default <T> T get(CacheKey<T> cacheKey) {
        return get(cacheKey.key(), cacheKey.type());
    }

    /**
     * 캐시에서 값을 조회합니다. 키가 없으면 empty를 반환합니다.
     *
     * @param key 캐시 키
     * @param type 값 타입
     * @param <T> 값 타입
     * @return 캐시 값 (Optional)
     */
    default <T> Optional<T> find(String key, Class<T> type) {
        try {
            return Optional.ofNullable(get(key, type));
        } catch (CacheException e) {
            if (e.is(CacheErrorType.KEY_NOT_FOUND)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    default <T> Optional<T> find(CacheKey<T> cacheKey) {
        return find(cacheKey.key(), cacheKey.type());
    }

    /**
     * 값을 조회하면서 TTL을 갱신합니다.
     *
     * @param key 캐시 키
     * @param type 값 타입
     * @param ttl 새 TTL
     * @param <T> 값 타입
     * @return 캐시 값
     */
    <T> T getAndExpire(String key, Class<T> type, Duration ttl);

    /**
     * 캐시에 값을 저장합니다.
     *
     * @param key 캐시 키
     * @param value 저장할 값 (null이면 {@link CacheErrorType#INVALID_ARGUMENT})
     * @param ttl TTL ({@link Duration#ZERO}이면 만료 없음)
     */
    void set(String key, Object value, Duration ttl);

    default <T> void set(CacheKey<T> cacheKey, T value) {
        set(cacheKey.key(), value, cacheKey.ttl());
    }

    /**
     * 키가 없을 때만 값을 저장합니다.
     *
     * @return 저장했으면 true
     */
    boolean setIfAbsent(String key, Object value, Duration ttl);

    /**
     * 키가 있을 때만 값을 저장합니다.
     *
     * @return 저장했으면 true
     */
    boolean setIfPresent(String key, Object value, Duration ttl);

    /**
     * 여러 값을 저장합니다.
     * <p>
     * 모든 값을 먼저 인코딩하므로 하나라도 인코딩에 실패하면 아무것도 쓰지 않습니다.
     * </p>
     *
     * @param values 키-값 쌍
     * @param ttl TTL
     */
    void mSet(Map<String, ?> values, Duration ttl);

    /**
     * 키를 삭제합니다. 없는 키를 삭제해도 오류가 아닙니다.
     *
     * @param keys 삭제할 키
     * @return 실제로 삭제된 키 수
     */
    long delete(String... keys);

    default void evict(CacheKey<?> cacheKey) {
        delete(cacheKey.key());
    }

    /**
     * 여러 키를 조회합니다.
     * <p>
     * 결과는 요청한 키 순서를 유지하며, 키별로 찾음/없음/디코딩 오류가 따로 분류됩니다.
     * 한 키의 디코딩 오류는 다른 키의 결과에 영향을 주지 않습니다.
     * </p>
     *
     * @param keys 키 목록 (중복 허용)
     * @param type 값 타입
     * @param <T> 값 타입
     * @return 키별 결과
     */
    <T> MultiResult<T> mGet(List<String> keys, Class<T> type);

    /**
     * 값을 원자적으로 읽고-수정하고-씁니다 (TTL 없음).
     *
     * @see #upsert(String, Class, Duration, UpsertCallback)
     */
    default <T> UpsertResult upsert(String key, Class<T> type, UpsertCallback<T> callback) {
        return upsert(key, type, Duration.ZERO, callback);
    }

    /**
     * 값을 원자적으로 읽고-수정하고-씁니다.
     * <p>
     * 이전에 읽은 바이트가 그대로일 때만 새 값을 씁니다 (compare-and-swap).
     * 그 사이 다른 쓰기가 있었으면 {@link CacheErrorType#RETRYABLE_CONFLICT}로 실패하며,
     * 설정된 경우 제한된 횟수만큼 내부에서 처음부터 다시 시도합니다.
     * </p>
     *
     * @param key 캐시 키
     * @param type 값 타입
     * @param ttl 쓸 값의 TTL
     * @param callback 갱신 함수
     * @param <T> 값 타입
     * @return 쓰기 여부
     */
    <T> UpsertResult upsert(String key, Class<T> type, Duration ttl, UpsertCallback<T> callback);

    /**
     * 남은 TTL을 조회합니다.
     *
     * @param key 캐시 키
     * @return 남은 TTL (만료가 없으면 empty)
     * @throws CacheException 키가 없으면 {@link CacheErrorType#KEY_NOT_FOUND}
     */
    Optional<Duration> ttl(String key);

    /**
     * TTL을 설정합니다. {@link Duration#ZERO}이면 만료를 제거합니다.
     *
     * @throws CacheException 키가 없으면 {@link CacheErrorType#KEY_NOT_FOUND}
     */
    void expire(String key, Duration ttl);

    /**
     * 저장소가 응답하는지 확인합니다.
     *
     * @return 응답하면 true
     */
    boolean healthy();

    /**
     * 파이프라인에 훅을 추가합니다.
     *
     * @param hook 훅
     */
    void addHook(CacheHook hook);

    /**
     * 캐시에서 값을 조회하고, 없으면 로더를 실행하여 값을 가져온 후 캐시에 저장합니다.
     * <p>
     * Cache-Aside 패턴을 구현합니다. 로더가 null을 반환하면 저장하지 않습니다.
     * </p>
     *
     * @param cacheKey 캐시 키
     * @param loader 캐시에 값이 없을 때 실행할 로더
     * @param <T> 캐시 값의 타입
     * @return 캐시 값 또는 로더로부터 가져온 값
     */
    default <T> T getOrLoad(CacheKey<T> cacheKey, Supplier<T> loader) {
        Optional<T> cached = find(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        T value = loader.get();
        if (value != null) {
            set(cacheKey, value);
        }
        return value;
    }
}
