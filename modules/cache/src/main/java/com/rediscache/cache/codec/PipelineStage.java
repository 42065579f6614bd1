package com.rediscache.cache.codec;

/**
 * 값이 저장소에 도달하기까지 거치는 단계.
 *
 * @author Loopers
 * @version 1.0
 */
public enum PipelineStage {
    ENCODE,
    COMPRESS,
    DECOMPRESS,
    DECODE,
    STORE
}
