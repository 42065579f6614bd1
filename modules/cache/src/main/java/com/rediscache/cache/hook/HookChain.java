package com.rediscache.cache.hook;

import com.rediscache.cache.codec.ByteTransformer;
import com.rediscache.cache.codec.Marshaller;
import com.rediscache.cache.codec.Unmarshaller;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * 훅 목록을 기본 함수 위에 합성한 결과.
 * <p>
 * 먼저 등록된 훅이 가장 바깥쪽 래퍼가 됩니다.
 * H1, H2 순서로 등록하면 호출은 H1 → H2 → 기본 함수 순서로 들어가고, H2 → H1 순서로 빠져나옵니다.
 * </p>
 *
 * @param marshaller 합성된 인코더
 * @param unmarshaller 합성된 디코더
 * @param compressor 합성된 압축 함수
 * @param decompressor 합성된 해제 함수
 * @param hooks 합성에 사용된 훅 (등록 순서)
 * @author Loopers
 * @version 1.0
 */
public record HookChain(
    Marshaller marshaller,
    Unmarshaller unmarshaller,
    ByteTransformer compressor,
    ByteTransformer decompressor,
    List<CacheHook> hooks
) {

    public HookChain {
        hooks = List.copyOf(hooks);
    }

    /**
     * 기본 함수 위에 훅을 합성합니다.
     *
     * @param marshaller 기본 인코더
     * @param unmarshaller 기본 디코더
     * @param compressor 기본 압축 함수
     * @param decompressor 기본 해제 함수
     * @param hooks 등록 순서의 훅 목록
     * @return 합성된 체인
     */
    public static HookChain compose(
        Marshaller marshaller,
        Unmarshaller unmarshaller,
        ByteTransformer compressor,
        ByteTransformer decompressor,
        List<CacheHook> hooks
    ) {
        return new HookChain(
            fold(marshaller, hooks, CacheHook::marshalHook),
            fold(unmarshaller, hooks, CacheHook::unmarshalHook),
            fold(compressor, hooks, CacheHook::compressHook),
            fold(decompressor, hooks, CacheHook::decompressHook),
            hooks
        );
    }

    private static <F> F fold(F base, List<CacheHook> hooks, BiFunction<CacheHook, F, F> wrap) {
        F current = base;
        for (int i = hooks.size() - 1; i >= 0; i--) {
            current = Objects.requireNonNull(wrap.apply(hooks.get(i), current), "hook returned null function");
        }
        return current;
    }
}
