package com.rediscache.cache;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 다중 조회 결과.
 * <p>
 * {@link #results()}는 요청한 키 순서(중복 포함)를 그대로 유지합니다.
 * </p>
 *
 * @param results 요청 순서의 키별 결과
 * @param <T> 값 타입
 * @author Loopers
 * @version 1.0
 */
public record MultiResult<T>(List<KeyResult<T>> results) {

    public MultiResult {
        results = List.copyOf(results);
    }

    /**
     * 키의 결과를 조회합니다. 중복 키는 첫 번째 결과를 반환합니다.
     *
     * @param key 키
     * @return 결과 (요청하지 않은 키면 empty)
     */
    public Optional<KeyResult<T>> get(String key) {
        return results.stream()
            .filter(result -> result.key().equals(key))
            .findFirst();
    }

    /**
     * 찾은 키와 값을 요청 순서대로 반환합니다.
     *
     * @return 키-값 맵
     */
    public Map<String, T> values() {
        Map<String, T> values = new LinkedHashMap<>();
        for (KeyResult<T> result : results) {
            if (result.isFound()) {
                values.putIfAbsent(result.key(), result.value());
            }
        }
        return values;
    }

    public List<String> foundKeys() {
        return results.stream()
            .filter(KeyResult::isFound)
            .map(KeyResult::key)
            .toList();
    }

    public int size() {
        return results.size();
    }
}
