package com.rediscache.cache;

import com.rediscache.cache.codec.CodecPipeline;
import com.rediscache.cache.codec.PipelineStage;
import com.rediscache.cache.hook.CacheHook;
import com.rediscache.cache.store.CacheStore;
import com.rediscache.support.error.CacheErrorType;
import com.rediscache.support.error.CacheException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link CacheStore} 위에서 동작하는 캐시 템플릿 구현체.
 * <p>
 * 값 변환은 {@link CodecPipeline}에, 저장은 {@link CacheStore}에 위임합니다.
 * 연산 사이에 프로세스 내부 락을 잡지 않으며, 동시 갱신의 정합성은 저장소의 원자적 조건부 쓰기에만 의존합니다.
 * </p>
 * <p>
 * <b>다중 조회:</b> 키 목록을 앞에서부터 최대 {@code batchSize}개씩 연속된 묶음으로 나누어 순서대로 요청하고,
 * 묶음 결과를 이어 붙입니다. 묶음이 연속적이고 순서를 바꾸지 않으므로 결과는 요청 순서와 같습니다.
 * </p>
 * <p>
 * <b>Upsert:</b> 읽은 바이트 자체를 버전으로 사용합니다.
 * 현재 바이트가 읽은 바이트와 같을 때만 쓰며, 다르면 {@link CacheErrorType#RETRYABLE_CONFLICT}로 실패합니다.
 * {@code upsertMaxAttempts}가 1보다 크면 Resilience4j Retry로 충돌만 제한된 횟수만큼 재시도합니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
@Slf4j
public class DefaultCacheTemplate implements CacheTemplate {

    private static final String OP_GET = "get";
    private static final String OP_GET_AND_EXPIRE = "getAndExpire";
    private static final String OP_SET = "set";
    private static final String OP_SET_IF_ABSENT = "setIfAbsent";
    private static final String OP_SET_IF_PRESENT = "setIfPresent";
    private static final String OP_MSET = "mSet";
    private static final String OP_DELETE = "delete";
    private static final String OP_MGET = "mGet";
    private static final String OP_UPSERT = "upsert";
    private static final String OP_TTL = "ttl";
    private static final String OP_EXPIRE = "expire";
    private static final String OP_PING = "ping";

    private final CacheStore store;
    private final CacheOptions options;
    private final CodecPipeline pipeline;
    private final Retry upsertRetry;

    public DefaultCacheTemplate(CacheStore store) {
        this(store, CacheOptions.defaults());
    }

    public DefaultCacheTemplate(CacheStore store, CacheOptions options) {
        this.store = Objects.requireNonNull(store, "store");
        this.options = Objects.requireNonNull(options, "options");
        options.validate();
        this.pipeline = new CodecPipeline(options.getCodec(), options.getCompressor(), options.getHooks());
        this.upsertRetry = options.getUpsertMaxAttempts() > 1 ? createUpsertRetry(options) : null;
    }

    public CacheOptions options() {
        return options;
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        checkKey(OP_GET, key);
        byte[] data = callStore(OP_GET, key, () -> read(key))
            .orElseThrow(() -> CacheException.keyNotFound(OP_GET, key));
        return decode(OP_GET, key, data, type);
    }

    @Override
    public <T> T getAndExpire(String key, Class<T> type, Duration ttl) {
        checkKey(OP_GET_AND_EXPIRE, key);
        Duration expiry = checkTtl(OP_GET_AND_EXPIRE, key, ttl);
        byte[] data = callStore(OP_GET_AND_EXPIRE, key, () -> store.getAndExpire(key, expiry))
            .orElseThrow(() -> CacheException.keyNotFound(OP_GET_AND_EXPIRE, key));
        return decode(OP_GET_AND_EXPIRE, key, data, type);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        checkKey(OP_SET, key);
        Duration expiry = checkTtl(OP_SET, key, ttl);
        byte[] data = encode(OP_SET, key, value);
        callStore(OP_SET, key, () -> {
            store.set(key, data, expiry);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, Object value, Duration ttl) {
        checkKey(OP_SET_IF_ABSENT, key);
        Duration expiry = checkTtl(OP_SET_IF_ABSENT, key, ttl);
        byte[] data = encode(OP_SET_IF_ABSENT, key, value);
        return callStore(OP_SET_IF_ABSENT, key, () -> store.setIfAbsent(key, data, expiry));
    }

    @Override
    public boolean setIfPresent(String key, Object value, Duration ttl) {
        checkKey(OP_SET_IF_PRESENT, key);
        Duration expiry = checkTtl(OP_SET_IF_PRESENT, key, ttl);
        byte[] data = encode(OP_SET_IF_PRESENT, key, value);
        return callStore(OP_SET_IF_PRESENT, key, () -> store.setIfPresent(key, data, expiry));
    }

    @Override
    public void mSet(Map<String, ?> values, Duration ttl) {
        Objects.requireNonNull(values, "values");
        Duration expiry = checkTtl(OP_MSET, null, ttl);
        if (values.isEmpty()) {
            return;
        }

        Map<String, byte[]> encoded = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            checkKey(OP_MSET, entry.getKey());
            encoded.put(entry.getKey(), encode(OP_MSET, entry.getKey(), entry.getValue()));
        }

        for (List<String> chunk : partition(new ArrayList<>(encoded.keySet()), options.getBatchSize())) {
            Map<String, byte[]> batch = new LinkedHashMap<>();
            for (String key : chunk) {
                batch.put(key, encoded.get(key));
            }
            callStore(OP_MSET, null, () -> {
                store.multiSet(batch, expiry);
                return null;
            });
        }
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0L;
        }
        for (String key : keys) {
            checkKey(OP_DELETE, key);
        }
        String contextKey = keys.length == 1 ? keys[0] : null;
        return callStore(OP_DELETE, contextKey, () -> store.delete(Arrays.asList(keys)));
    }

    @Override
    public <T> MultiResult<T> mGet(List<String> keys, Class<T> type) {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            return new MultiResult<>(List.of());
        }
        for (String key : keys) {
            checkKey(OP_MGET, key);
        }

        List<KeyResult<T>> results = new ArrayList<>(keys.size());
        for (List<String> chunk : partition(keys, options.getBatchSize())) {
            List<byte[]> values = callStore(OP_MGET, null, () -> readAll(chunk));
            if (values == null || values.size() != chunk.size()) {
                throw new CacheException(CacheErrorType.STORE_ERROR,
                    "다중 조회 응답 수가 요청 키 수와 다릅니다.", OP_MGET, null, PipelineStage.STORE, null);
            }
            for (int i = 0; i < chunk.size(); i++) {
                results.add(classify(chunk.get(i), values.get(i), type));
            }
        }
        return new MultiResult<>(results);
    }

    @Override
    public <T> UpsertResult upsert(String key, Class<T> type, Duration ttl, UpsertCallback<T> callback) {
        checkKey(OP_UPSERT, key);
        Duration expiry = checkTtl(OP_UPSERT, key, ttl);
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(callback, "callback");

        if (upsertRetry == null) {
            return attemptUpsert(key, type, expiry, callback);
        }

        try {
            return upsertRetry.executeSupplier(() -> attemptUpsert(key, type, expiry, callback));
        } catch (CacheException e) {
            if (e.is(CacheErrorType.RETRYABLE_CONFLICT) && Thread.currentThread().isInterrupted()) {
                throw new CacheException(CacheErrorType.CANCELLED, null, OP_UPSERT, key, PipelineStage.STORE, e);
            }
            throw e;
        }
    }

    @Override
    public Optional<Duration> ttl(String key) {
        checkKey(OP_TTL, key);
        Duration remaining = callStore(OP_TTL, key, () -> store.ttl(key))
            .orElseThrow(() -> CacheException.keyNotFound(OP_TTL, key));
        return remaining.isZero() ? Optional.empty() : Optional.of(remaining);
    }

    @Override
    public void expire(String key, Duration ttl) {
        checkKey(OP_EXPIRE, key);
        Duration expiry = checkTtl(OP_EXPIRE, key, ttl);
        boolean exists = callStore(OP_EXPIRE, key, () -> store.expire(key, expiry));
        if (!exists) {
            throw CacheException.keyNotFound(OP_EXPIRE, key);
        }
    }

    @Override
    public boolean healthy() {
        try {
            return callStore(OP_PING, null, store::ping);
        } catch (CacheException e) {
            if (e.is(CacheErrorType.CANCELLED)) {
                throw e;
            }
            log.warn("저장소 상태 확인 실패.", e);
            return false;
        }
    }

    @Override
    public void addHook(CacheHook hook) {
        pipeline.addHook(hook);
    }

    /**
     * CAS 한 번을 시도합니다.
     * <ol>
     *   <li>현재 바이트를 저장소에서 직접 읽습니다 (없으면 "값 없음").</li>
     *   <li>디코딩한 현재 값으로 콜백을 호출합니다.</li>
     *   <li>콜백이 중단하면 쓰지 않고 반환합니다.</li>
     *   <li>새 값을 인코딩하고, 현재 바이트가 1단계와 같을 때만 씁니다.</li>
     * </ol>
     */
    private <T> UpsertResult attemptUpsert(String key, Class<T> type, Duration ttl, UpsertCallback<T> callback) {
        Optional<byte[]> previous = callStore(OP_UPSERT, key, () -> store.get(key));
        Optional<T> current = previous.map(data -> decode(OP_UPSERT, key, data, type));

        Optional<T> next = callback.update(current);
        if (next == null || next.isEmpty()) {
            log.debug("Upsert 중단: 콜백이 값을 반환하지 않았습니다. (key: {})", key);
            return UpsertResult.ABORTED;
        }

        byte[] data = encode(OP_UPSERT, key, next.get());
        byte[] expected = previous.orElse(null);
        boolean written = callStore(OP_UPSERT, key, () -> store.compareAndSet(key, expected, data, ttl));
        if (!written) {
            log.debug("Upsert 충돌: 읽은 이후 값이 변경되었습니다. (key: {})", key);
            throw new CacheException(CacheErrorType.RETRYABLE_CONFLICT, null, OP_UPSERT, key, PipelineStage.STORE, null);
        }
        return UpsertResult.WRITTEN;
    }

    private Optional<byte[]> read(String key) {
        if (options.nearCacheEnabled()) {
            return store.getCached(key, options.getNearCacheTtl());
        }
        return store.get(key);
    }

    private List<byte[]> readAll(List<String> keys) {
        if (options.nearCacheEnabled()) {
            return store.multiGetCached(keys, options.getNearCacheTtl());
        }
        return store.multiGet(keys);
    }

    private <T> KeyResult<T> classify(String key, byte[] data, Class<T> type) {
        if (data == null) {
            return KeyResult.notFound(key);
        }
        try {
            return KeyResult.found(key, decode(OP_MGET, key, data, type));
        } catch (CacheException e) {
            if (!e.is(CacheErrorType.DATA_CORRUPTION)) {
                throw e;
            }
            log.warn("다중 조회 중 디코딩 실패. (key: {}, stage: {})", key, e.getStage(), e);
            return KeyResult.decodeError(key, e);
        }
    }

    private byte[] encode(String operation, String key, Object value) {
        if (value == null) {
            // 저장된 null은 조회 시 "값 없음"과 구분할 수 없다.
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "캐시 값은 null일 수 없습니다.",
                operation, key, null, null);
        }
        try {
            return pipeline.toBytes(value);
        } catch (CacheException e) {
            throw e.withContext(operation, key);
        }
    }

    private <T> T decode(String operation, String key, byte[] data, Class<T> type) {
        try {
            return pipeline.fromBytes(data, type);
        } catch (CacheException e) {
            throw e.withContext(operation, key);
        }
    }

    private <R> R callStore(String operation, String key, Supplier<R> call) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CacheException(CacheErrorType.CANCELLED, null, operation, key, PipelineStage.STORE, null);
        }
        try {
            return call.get();
        } catch (CacheException e) {
            throw e.withContext(operation, key);
        } catch (RuntimeException e) {
            throw new CacheException(CacheErrorType.STORE_ERROR, null, operation, key, PipelineStage.STORE, e);
        }
    }

    private static void checkKey(String operation, String key) {
        if (key == null || key.isEmpty()) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "캐시 키는 비어 있을 수 없습니다.",
                operation, key, null, null);
        }
    }

    private static Duration checkTtl(String operation, String key, Duration ttl) {
        if (ttl == null) {
            return Duration.ZERO;
        }
        if (ttl.isNegative()) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "TTL은 음수일 수 없습니다: " + ttl,
                operation, key, null, null);
        }
        return ttl;
    }

    static List<List<String>> partition(List<String> keys, int batchSize) {
        if (batchSize <= 0 || keys.size() <= batchSize) {
            return List.of(keys);
        }
        List<List<String>> chunks = new ArrayList<>((keys.size() + batchSize - 1) / batchSize);
        for (int from = 0; from < keys.size(); from += batchSize) {
            chunks.add(keys.subList(from, Math.min(from + batchSize, keys.size())));
        }
        return chunks;
    }

    private static Retry createUpsertRetry(CacheOptions options) {
        Duration backoff = options.getUpsertBackoff();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(options.getUpsertMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(backoff, 2.0, backoff.multipliedBy(50)))
            .retryOnException(throwable -> throwable instanceof CacheException e
                && e.is(CacheErrorType.RETRYABLE_CONFLICT))
            .build();
        return Retry.of("cache-upsert", config);
    }
}
