package com.rediscache.cache.codec;

import java.io.IOException;

/**
 * 바이트를 대상 타입의 값으로 변환하는 함수.
 *
 * @author Loopers
 * @version 1.0
 */
@FunctionalInterface
public interface Unmarshaller {

    Object unmarshal(byte[] data, Class<?> type) throws IOException;
}
