package com.rediscache.cache.codec;

import java.io.IOException;

/**
 * 압축/해제 함수 쌍.
 * <p>
 * 무손실이어야 하며, 빈 입력이나 이미 압축된 입력을 받아도 상태를 손상시키지 않아야 합니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public interface Compressor {

    byte[] compress(byte[] data) throws IOException;

    byte[] decompress(byte[] data) throws IOException;

    /**
     * 압축 단계가 실제로 수행되는지 여부.
     * <p>
     * false이면 파이프라인은 압축/해제 단계와 해당 훅을 건너뜁니다.
     * </p>
     */
    default boolean enabled() {
        return true;
    }

    /**
     * 압축을 수행하지 않는 기본 Compressor를 반환합니다.
     *
     * @return 항등 Compressor
     */
    static Compressor none() {
        return NoCompression.INSTANCE;
    }

    enum NoCompression implements Compressor {
        INSTANCE;

        @Override
        public byte[] compress(byte[] data) {
            return data;
        }

        @Override
        public byte[] decompress(byte[] data) {
            return data;
        }

        @Override
        public boolean enabled() {
            return false;
        }
    }
}
