package com.rediscache.cache.codec;

import java.io.IOException;

/**
 * 바이트 배열을 다른 바이트 배열로 변환하는 함수 (압축/해제).
 *
 * @author Loopers
 * @version 1.0
 */
@FunctionalInterface
public interface ByteTransformer {

    byte[] apply(byte[] data) throws IOException;

    static ByteTransformer identity() {
        return data -> data;
    }
}
