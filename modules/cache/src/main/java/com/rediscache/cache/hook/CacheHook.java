package com.rediscache.cache.hook;

import com.rediscache.cache.codec.ByteTransformer;
import com.rediscache.cache.codec.Marshaller;
import com.rediscache.cache.codec.Unmarshaller;

/**
 * 파이프라인 단계를 감싸는 미들웨어.
 * <p>
 * 각 메서드는 체인의 다음 함수를 받아 동일한 시그니처의 대체 함수를 반환합니다.
 * 감쌀 필요가 없는 단계는 기본 구현이 {@code next}를 그대로 반환합니다.
 * </p>
 * <p>
 * <b>규약:</b>
 * <ul>
 *   <li>관찰형 훅은 {@code next}의 결과를 그대로 반환합니다.</li>
 *   <li>변환형 훅은 결과를 바꿀 수 있으며, 구현체 문서에 변환형임을 명시해야 합니다.</li>
 *   <li>예외를 삼키면 안 됩니다. 가로챈 경우 같은 분류이거나 더 구체적인 예외를 다시 던져야 합니다.</li>
 * </ul>
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public interface CacheHook {

    default Marshaller marshalHook(Marshaller next) {
        return next;
    }

    default Unmarshaller unmarshalHook(Unmarshaller next) {
        return next;
    }

    default ByteTransformer compressHook(ByteTransformer next) {
        return next;
    }

    default ByteTransformer decompressHook(ByteTransformer next) {
        return next;
    }
}
