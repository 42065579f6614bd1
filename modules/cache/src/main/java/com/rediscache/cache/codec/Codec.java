package com.rediscache.cache.codec;

import java.io.IOException;

/**
 * 값 인코더/디코더 쌍.
 * <p>
 * 구현체는 {@code decode(encode(v), type)}가 {@code v}와 동등한 값을 반환해야 합니다.
 * 하나의 캐시 인스턴스는 생성 시점에 지정된 코덱 하나만 사용합니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public interface Codec {

    /**
     * 값을 바이트로 인코딩합니다.
     *
     * @param value 인코딩할 값
     * @return 인코딩된 바이트
     * @throws IOException 인코딩 실패 시
     */
    byte[] encode(Object value) throws IOException;

    /**
     * 바이트를 대상 타입으로 디코딩합니다.
     *
     * @param data 디코딩할 바이트
     * @param type 대상 타입
     * @param <T> 대상 타입
     * @return 디코딩된 값
     * @throws IOException 디코딩 실패 시
     */
    <T> T decode(byte[] data, Class<T> type) throws IOException;
}
