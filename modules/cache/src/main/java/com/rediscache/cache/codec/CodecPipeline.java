package com.rediscache.cache.codec;

import com.rediscache.cache.hook.CacheHook;
import com.rediscache.cache.hook.HookChain;
import com.rediscache.support.error.CacheErrorType;
import com.rediscache.support.error.CacheException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 코덱, Compressor, 훅을 하나로 묶은 변환 파이프라인.
 * <p>
 * 저장되는 바이트는 항상 {@code compress(encode(value))}이며,
 * 읽을 때는 {@code decode(decompress(bytes))}를 적용합니다.
 * Compressor가 비활성화되어 있으면 압축/해제 단계와 해당 훅은 실행되지 않습니다.
 * </p>
 * <p>
 * <b>에러 분류:</b>
 * <ul>
 *   <li>인코딩/압축 실패: {@link CacheErrorType#ENCODE_ERROR}</li>
 *   <li>해제 실패: {@link CacheErrorType#DATA_CORRUPTION}</li>
 *   <li>디코딩 실패: {@link CacheErrorType#DECODE_ERROR}</li>
 * </ul>
 * 훅이 던진 예외가 단계의 분류보다 덜 구체적이면 단계의 분류로 다시 감쌉니다.
 * 파이프라인은 어떤 오류도 재시도하지 않습니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public class CodecPipeline {

    private final Codec codec;
    private final Compressor compressor;
    private final Object hookLock = new Object();
    private volatile HookChain chain;

    public CodecPipeline(Codec codec, Compressor compressor, List<CacheHook> hooks) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.compressor = Objects.requireNonNull(compressor, "compressor");
        this.chain = compose(List.copyOf(hooks));
    }

    /**
     * 훅을 마지막 위치에 등록하고 합성 결과를 다시 만듭니다.
     * <p>
     * 진행 중인 호출은 이전 합성 결과로 끝까지 실행됩니다.
     * </p>
     *
     * @param hook 등록할 훅
     */
    public void addHook(CacheHook hook) {
        Objects.requireNonNull(hook, "hook");
        synchronized (hookLock) {
            List<CacheHook> hooks = new ArrayList<>(chain.hooks());
            hooks.add(hook);
            chain = compose(hooks);
        }
    }

    public List<CacheHook> hooks() {
        return chain.hooks();
    }

    /**
     * 값을 저장할 바이트로 변환합니다.
     *
     * @param value 값
     * @return {@code compress(encode(value))}
     */
    public byte[] toBytes(Object value) {
        HookChain current = chain;
        byte[] encoded = run(PipelineStage.ENCODE, CacheErrorType.ENCODE_ERROR,
            () -> current.marshaller().marshal(value));
        if (!compressor.enabled()) {
            return encoded;
        }
        return run(PipelineStage.COMPRESS, CacheErrorType.ENCODE_ERROR,
            () -> current.compressor().apply(encoded));
    }

    /**
     * 저장된 바이트를 대상 타입의 값으로 복원합니다.
     *
     * @param data 저장된 바이트
     * @param type 대상 타입
     * @param <T> 대상 타입
     * @return {@code decode(decompress(data))}
     */
    public <T> T fromBytes(byte[] data, Class<T> type) {
        HookChain current = chain;
        byte[] decompressed = data;
        if (compressor.enabled()) {
            decompressed = run(PipelineStage.DECOMPRESS, CacheErrorType.DATA_CORRUPTION,
                () -> current.decompressor().apply(data));
        }

        byte[] payload = decompressed;
        Object value = run(PipelineStage.DECODE, CacheErrorType.DECODE_ERROR,
            () -> current.unmarshaller().unmarshal(payload, type));
        if (value != null && !type.isInstance(value)) {
            throw new CacheException(CacheErrorType.DECODE_ERROR,
                "디코딩 결과 타입이 일치하지 않습니다: " + value.getClass().getName() + " -> " + type.getName(),
                null, null, PipelineStage.DECODE, null);
        }
        return type.cast(value);
    }

    private HookChain compose(List<CacheHook> hooks) {
        return HookChain.compose(
            codec::encode,
            (data, type) -> codec.decode(data, type),
            compressor::compress,
            compressor::decompress,
            hooks
        );
    }

    private static <R> R run(PipelineStage stage, CacheErrorType errorType, StageCall<R> call) {
        R result;
        try {
            result = call.call();
        } catch (CacheException e) {
            if (e.is(errorType)) {
                throw e;
            }
            throw new CacheException(errorType, null, null, null, stage, e);
        } catch (IOException | RuntimeException e) {
            throw new CacheException(errorType, null, null, null, stage, e);
        }

        if (result == null && stage != PipelineStage.DECODE) {
            throw new CacheException(errorType, stage + " 단계가 null을 반환했습니다.", null, null, stage, null);
        }
        return result;
    }

    @FunctionalInterface
    private interface StageCall<R> {
        R call() throws IOException;
    }
}
