package com.rediscache.cache;

import java.util.Optional;

/**
 * Upsert의 갱신 함수.
 * <p>
 * 충돌로 재시도될 때마다 다시 호출되므로 부수 효과가 없어야 합니다.
 * </p>
 *
 * @param <T> 값 타입
 * @author Loopers
 * @version 1.0
 */
@FunctionalInterface
public interface UpsertCallback<T> {

    /**
     * 현재 값으로부터 새 값을 계산합니다.
     *
     * @param current 현재 값 (키가 없으면 empty)
     * @return 쓸 값. empty를 반환하면 아무것도 쓰지 않고 중단합니다
     */
    Optional<T> update(Optional<T> current);
}
