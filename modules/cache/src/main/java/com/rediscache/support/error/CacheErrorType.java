package com.rediscache.support.error;

import lombok.Getter;

/**
 * 캐시 에러 유형.
 * <p>
 * 호출자는 에러 유형만으로 재시도 여부와 처리 방법을 결정할 수 있습니다.
 * 일부 유형은 상위 유형을 가지며, 하위 유형은 상위 유형보다 더 구체적인 분류입니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
@Getter
public enum CacheErrorType {

    /** 키가 존재하지 않음. 예상 가능한 결과이며 장애로 기록하지 않습니다. */
    KEY_NOT_FOUND(null, "키가 존재하지 않습니다.", false),

    /** 값 직렬화 실패 (프로그래밍/스키마 오류). */
    ENCODE_ERROR(null, "값을 인코딩할 수 없습니다.", false),

    /** 저장된 바이트를 복원할 수 없음. */
    DATA_CORRUPTION(null, "저장된 데이터가 손상되었습니다.", false),

    /** 저장된 바이트를 대상 타입으로 역직렬화할 수 없음. */
    DECODE_ERROR(DATA_CORRUPTION, "값을 디코딩할 수 없습니다.", false),

    /** 저장소 전송/서버 오류. */
    STORE_ERROR(null, "저장소 요청이 실패했습니다.", false),

    /** Upsert 조건부 쓰기 충돌. 전체 read-modify-write를 다시 시도할 수 있습니다. */
    RETRYABLE_CONFLICT(null, "다른 쓰기와 충돌했습니다.", true),

    /** 호출 스레드가 인터럽트되어 요청이 취소됨. */
    CANCELLED(null, "요청이 취소되었습니다.", false),

    /** 저장소 명령 타임아웃. */
    TIMEOUT(null, "요청 시간이 초과되었습니다.", true),

    /** 잘못된 인자. */
    INVALID_ARGUMENT(null, "잘못된 요청입니다.", false);

    private final CacheErrorType parent;
    private final String message;
    private final boolean retryable;

    CacheErrorType(CacheErrorType parent, String message, boolean retryable) {
        this.parent = parent;
        this.message = message;
        this.retryable = retryable;
    }

    /**
     * 이 유형이 주어진 유형과 같거나 더 구체적인지 확인합니다.
     *
     * @param other 비교할 유형
     * @return 같거나 하위 유형이면 true
     */
    public boolean is(CacheErrorType other) {
        for (CacheErrorType type = this; type != null; type = type.parent) {
            if (type == other) {
                return true;
            }
        }
        return false;
    }
}
