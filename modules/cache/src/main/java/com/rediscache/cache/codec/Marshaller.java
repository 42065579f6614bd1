package com.rediscache.cache.codec;

import java.io.IOException;

/**
 * 값을 바이트로 변환하는 함수.
 *
 * @author Loopers
 * @version 1.0
 */
@FunctionalInterface
public interface Marshaller {

    byte[] marshal(Object value) throws IOException;
}
