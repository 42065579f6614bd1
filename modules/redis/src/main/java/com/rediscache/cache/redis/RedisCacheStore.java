package com.rediscache.cache.redis;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.rediscache.cache.codec.PipelineStage;
import com.rediscache.cache.store.CacheStore;
import com.rediscache.support.error.CacheErrorType;
import com.rediscache.support.error.CacheException;
import io.lettuce.core.RedisCommandInterruptedException;
import io.lettuce.core.RedisCommandTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStringCommands;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.types.Expiration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis 기반 {@link CacheStore} 구현체.
 * <p>
 * 조회({@link #get(String)}, {@link #multiGet(List)})와 모든 쓰기는 마스터 연결을 사용하고,
 * near-cache 경유 조회는 레플리카 우선 연결을 사용합니다.
 * near-cache를 거치지 않는 조회는 직전 쓰기를 항상 볼 수 있습니다.
 * </p>
 * <p>
 * <b>near-cache:</b> 요청한 TTL만큼만 유지되는 Caffeine 캐시입니다.
 * 이 저장소를 통한 쓰기, 삭제, CAS는 해당 키를 즉시 무효화하며,
 * 다른 클라이언트의 쓰기에 대한 지연은 TTL로 제한됩니다.
 * </p>
 * <p>
 * <b>예외 변환:</b>
 * <ul>
 *   <li>명령 타임아웃: {@link CacheErrorType#TIMEOUT}</li>
 *   <li>호출 스레드 인터럽트: {@link CacheErrorType#CANCELLED}</li>
 *   <li>그 외: {@link CacheErrorType#STORE_ERROR}</li>
 * </ul>
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    private static final long KEY_ABSENT = -2L;
    private static final long NO_EXPIRY = -1L;

    private final RedisTemplate<String, byte[]> readTemplate;
    private final RedisTemplate<String, byte[]> masterTemplate;
    private final CompareAndSetScript compareAndSetScript = new CompareAndSetScript();
    private final Cache<String, NearEntry> nearCache;

    public RedisCacheStore(RedisTemplate<String, byte[]> readTemplate,
                           RedisTemplate<String, byte[]> masterTemplate,
                           long nearCacheMaxSize) {
        this.readTemplate = Objects.requireNonNull(readTemplate, "readTemplate");
        this.masterTemplate = Objects.requireNonNull(masterTemplate, "masterTemplate");
        this.nearCache = Caffeine.newBuilder()
            .maximumSize(nearCacheMaxSize)
            .expireAfter(new NearEntryExpiry())
            .recordStats()
            .build();
    }

    @Override
    public Optional<byte[]> get(String key) {
        return execute("GET", key, () -> Optional.ofNullable(masterTemplate.opsForValue().get(key)));
    }

    @Override
    public Optional<byte[]> getCached(String key, Duration nearCacheTtl) {
        NearEntry cached = nearCache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached.value());
        }

        Optional<byte[]> value = execute("GET", key, () -> Optional.ofNullable(readTemplate.opsForValue().get(key)));
        value.ifPresent(data -> nearCache.put(key, new NearEntry(data, nearCacheTtl)));
        return value;
    }

    @Override
    public Optional<byte[]> getAndExpire(String key, Duration ttl) {
        nearCache.invalidate(key);
        return execute("GETEX", key, () -> Optional.ofNullable(ttl.isZero()
            ? masterTemplate.opsForValue().getAndPersist(key)
            : masterTemplate.opsForValue().getAndExpire(key, atLeastOneMilli(ttl))));
    }

    @Override
    public List<byte[]> multiGet(List<String> keys) {
        return multiGet(masterTemplate, keys);
    }

    private List<byte[]> multiGet(RedisTemplate<String, byte[]> template, List<String> keys) {
        List<byte[]> values = execute("MGET", null, () -> template.opsForValue().multiGet(keys));
        if (values == null) {
            throw new CacheException(CacheErrorType.STORE_ERROR, "MGET 응답이 없습니다.", null, null,
                PipelineStage.STORE, null);
        }
        return values;
    }

    @Override
    public List<byte[]> multiGetCached(List<String> keys, Duration nearCacheTtl) {
        List<byte[]> values = new ArrayList<>(keys.size());
        List<String> misses = new ArrayList<>();
        for (String key : keys) {
            NearEntry cached = nearCache.getIfPresent(key);
            values.add(cached != null ? cached.value() : null);
            if (cached == null) {
                misses.add(key);
            }
        }
        if (misses.isEmpty()) {
            return values;
        }

        List<byte[]> fetched = multiGet(readTemplate, misses);
        int cursor = 0;
        for (int i = 0; i < keys.size(); i++) {
            if (values.get(i) != null) {
                continue;
            }
            byte[] data = fetched.get(cursor++);
            values.set(i, data);
            if (data != null) {
                nearCache.put(keys.get(i), new NearEntry(data, nearCacheTtl));
            }
        }
        return values;
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        nearCache.invalidate(key);
        execute("SET", key, () -> {
            if (ttl.isZero()) {
                masterTemplate.opsForValue().set(key, value);
            } else {
                masterTemplate.opsForValue().set(key, value, atLeastOneMilli(ttl));
            }
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, byte[] value, Duration ttl) {
        nearCache.invalidate(key);
        return execute("SETNX", key, () -> Boolean.TRUE.equals(ttl.isZero()
            ? masterTemplate.opsForValue().setIfAbsent(key, value)
            : masterTemplate.opsForValue().setIfAbsent(key, value, atLeastOneMilli(ttl))));
    }

    @Override
    public boolean setIfPresent(String key, byte[] value, Duration ttl) {
        nearCache.invalidate(key);
        return execute("SETXX", key, () -> Boolean.TRUE.equals(ttl.isZero()
            ? masterTemplate.opsForValue().setIfPresent(key, value)
            : masterTemplate.opsForValue().setIfPresent(key, value, atLeastOneMilli(ttl))));
    }

    @Override
    public void multiSet(Map<String, byte[]> values, Duration ttl) {
        nearCache.invalidateAll(values.keySet());
        Expiration expiration = ttl.isZero()
            ? Expiration.persistent()
            : Expiration.milliseconds(atLeastOneMilli(ttl).toMillis());
        execute("MSET", null, () -> masterTemplate.executePipelined((RedisCallback<Object>) connection -> {
            for (Map.Entry<String, byte[]> entry : values.entrySet()) {
                connection.stringCommands().set(rawKey(entry.getKey()), entry.getValue(), expiration,
                    RedisStringCommands.SetOption.upsert());
            }
            return null;
        }));
    }

    @Override
    public long delete(Collection<String> keys) {
        nearCache.invalidateAll(keys);
        Long removed = execute("DEL", keys.size() == 1 ? keys.iterator().next() : null,
            () -> masterTemplate.delete(keys));
        return removed != null ? removed : 0L;
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long millis = execute("PTTL", key, () -> masterTemplate.getExpire(key, TimeUnit.MILLISECONDS));
        if (millis == null || millis == KEY_ABSENT) {
            return Optional.empty();
        }
        if (millis == NO_EXPIRY) {
            return Optional.of(Duration.ZERO);
        }
        return Optional.of(Duration.ofMillis(Math.max(1L, millis)));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        if (!ttl.isZero()) {
            return execute("PEXPIRE", key, () -> Boolean.TRUE.equals(masterTemplate.expire(key, atLeastOneMilli(ttl))));
        }
        // PERSIST는 만료가 없던 키에도 0을 반환한다.
        return execute("PERSIST", key, () -> Boolean.TRUE.equals(masterTemplate.persist(key))
            || Boolean.TRUE.equals(masterTemplate.hasKey(key)));
    }

    @Override
    public boolean compareAndSet(String key, byte[] expected, byte[] value, Duration ttl) {
        nearCache.invalidate(key);
        return execute("EVAL", key, () -> compareAndSetScript.execute(masterTemplate, key, expected, value,
            ttl.isZero() ? ttl : atLeastOneMilli(ttl)));
    }

    @Override
    public boolean ping() {
        String pong = execute("PING", null, () -> masterTemplate.execute(RedisConnection::ping, true));
        return "PONG".equalsIgnoreCase(pong);
    }

    public Cache<String, ?> nearCache() {
        return nearCache;
    }

    private <R> R execute(String command, String key, Supplier<R> call) {
        try {
            return call.get();
        } catch (CacheException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(command, key, e);
        }
    }

    private CacheException translate(String command, String key, RuntimeException e) {
        String message = "Redis " + command + " 실패";
        if (Thread.currentThread().isInterrupted() || hasCause(e, RedisCommandInterruptedException.class)
            || hasCause(e, InterruptedException.class)) {
            return new CacheException(CacheErrorType.CANCELLED, message, null, key, PipelineStage.STORE, e);
        }
        if (e instanceof QueryTimeoutException || hasCause(e, RedisCommandTimeoutException.class)) {
            log.warn("Redis 명령 타임아웃. (command: {}, key: {})", command, key);
            return new CacheException(CacheErrorType.TIMEOUT, message, null, key, PipelineStage.STORE, e);
        }
        log.warn("Redis 명령 실패. (command: {}, key: {})", command, key, e);
        return new CacheException(CacheErrorType.STORE_ERROR, message, null, key, PipelineStage.STORE, e);
    }

    private static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        for (Throwable current = throwable; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }

    private static Duration atLeastOneMilli(Duration ttl) {
        return ttl.toMillis() < 1 ? Duration.ofMillis(1) : ttl;
    }

    private static byte[] rawKey(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private record NearEntry(byte[] value, Duration ttl) {
    }

    private static final class NearEntryExpiry implements Expiry<String, NearEntry> {

        @Override
        public long expireAfterCreate(String key, NearEntry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, NearEntry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, NearEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
