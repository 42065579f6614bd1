package com.rediscache.cache;

/**
 * Upsert 결과.
 *
 * @author Loopers
 * @version 1.0
 */
public enum UpsertResult {
    /** 새 값을 썼음. */
    WRITTEN,
    /** 콜백이 중단을 요청하여 아무것도 쓰지 않았음. */
    ABORTED
}
