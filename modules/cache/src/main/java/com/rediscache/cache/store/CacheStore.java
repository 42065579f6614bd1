package com.rediscache.cache.store;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 캐시가 바이트를 저장하는 원격 키-값 저장소.
 * <p>
 * 구현체는 오류를 {@link com.rediscache.support.error.CacheException}으로 변환해야 하며,
 * 호출 스레드가 인터럽트되면 {@code CANCELLED}, 명령 타임아웃이면 {@code TIMEOUT},
 * 그 밖의 전송/서버 오류는 {@code STORE_ERROR}로 분류합니다.
 * </p>
 * <p>
 * TTL 인자는 {@link Duration#ZERO}이면 만료 없음을 의미합니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public interface CacheStore {

    /**
     * 저장소에서 직접 값을 조회합니다. 클라이언트 캐시를 거치지 않습니다.
     *
     * @param key 키
     * @return 저장된 바이트 (없으면 empty)
     */
    Optional<byte[]> get(String key);

    /**
     * 값을 조회하되, 클라이언트 캐시(near-cache)가 있으면 최대 {@code nearCacheTtl} 동안 로컬 사본을 사용할 수 있습니다.
     *
     * @param key 키
     * @param nearCacheTtl 로컬 사본을 사용할 수 있는 최대 시간
     * @return 저장된 바이트 (없으면 empty)
     */
    default Optional<byte[]> getCached(String key, Duration nearCacheTtl) {
        return get(key);
    }

    /**
     * 값을 조회하면서 TTL을 갱신합니다.
     *
     * @param key 키
     * @param ttl 새 TTL
     * @return 저장된 바이트 (없으면 empty)
     */
    Optional<byte[]> getAndExpire(String key, Duration ttl);

    /**
     * 여러 키를 한 번의 요청으로 조회합니다.
     * <p>
     * {@link #get(String)}과 같은 정합성을 가지며, 직전 쓰기를 볼 수 있어야 합니다.
     * </p>
     *
     * @param keys 키 목록 (중복 허용)
     * @return 키 순서와 같은 순서의 바이트 목록. 없는 키는 null
     */
    List<byte[]> multiGet(List<String> keys);

    /**
     * 여러 키를 조회하되, 클라이언트 캐시가 있으면 로컬 사본을 사용할 수 있습니다.
     *
     * @param keys 키 목록
     * @param nearCacheTtl 로컬 사본을 사용할 수 있는 최대 시간
     * @return 키 순서와 같은 순서의 바이트 목록. 없는 키는 null
     */
    default List<byte[]> multiGetCached(List<String> keys, Duration nearCacheTtl) {
        return multiGet(keys);
    }

    void set(String key, byte[] value, Duration ttl);

    boolean setIfAbsent(String key, byte[] value, Duration ttl);

    boolean setIfPresent(String key, byte[] value, Duration ttl);

    /**
     * 여러 값을 한 번의 요청으로 저장합니다.
     *
     * @param values 키-바이트 쌍
     * @param ttl TTL
     */
    void multiSet(Map<String, byte[]> values, Duration ttl);

    /**
     * 키를 삭제합니다. 없는 키는 무시합니다.
     *
     * @param keys 삭제할 키
     * @return 실제로 삭제된 키 수
     */
    long delete(Collection<String> keys);

    /**
     * 남은 TTL을 조회합니다.
     *
     * @param key 키
     * @return 키가 없으면 empty, 만료가 없으면 {@link Duration#ZERO}, 그 외에는 남은 시간
     */
    Optional<Duration> ttl(String key);

    /**
     * TTL을 설정합니다. {@link Duration#ZERO}이면 만료를 제거합니다.
     *
     * @param key 키
     * @param ttl TTL
     * @return 키가 존재했으면 true
     */
    boolean expire(String key, Duration ttl);

    /**
     * 현재 값이 기대값과 바이트 단위로 같을 때만 새 값을 씁니다.
     * <p>
     * 비교와 쓰기는 저장소에서 하나의 원자적 연산으로 실행되어야 합니다.
     * </p>
     *
     * @param key 키
     * @param expected 기대하는 현재 바이트. null이면 키가 없어야 함을 의미
     * @param value 새 바이트
     * @param ttl TTL
     * @return 썼으면 true, 현재 값이 달라 쓰지 않았으면 false
     */
    boolean compareAndSet(String key, byte[] expected, byte[] value, Duration ttl);

    /**
     * 저장소가 응답하는지 확인합니다.
     *
     * @return 응답하면 true
     */
    boolean ping();
}
