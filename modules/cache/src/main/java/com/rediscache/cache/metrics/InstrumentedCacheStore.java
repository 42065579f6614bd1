package com.rediscache.cache.metrics;

import com.rediscache.cache.store.CacheStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 저장소 명령의 소요 시간, 오류, 조회 적중 여부를 기록하는 {@link CacheStore} 데코레이터.
 * <p>
 * <b>메트릭:</b>
 * <ul>
 *   <li>{@code cache.command.duration} (command, outcome=success|error)</li>
 *   <li>{@code cache.command.errors} (command)</li>
 *   <li>{@code cache.command.hits}, {@code cache.command.misses} (command): 조회 명령의 키별 적중 여부</li>
 * </ul>
 * 명령별 미터는 처음 사용할 때 한 번만 등록하고 이후에는 재사용합니다.
 * 메트릭 기록은 메모리 내에서만 이루어지며 호출 결과 경로를 막지 않습니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public class InstrumentedCacheStore implements CacheStore {

    private final CacheStore delegate;
    private final MeterRegistry meterRegistry;
    private final Tags tags;
    private final Duration[] buckets;
    private final ConcurrentMap<String, CommandMeters> commandMeters = new ConcurrentHashMap<>();

    public InstrumentedCacheStore(CacheStore delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, Tags.empty(), MetricsBuckets.DEFAULT_COMMAND_BUCKETS);
    }

    public InstrumentedCacheStore(CacheStore delegate, MeterRegistry meterRegistry,
                                  Iterable<Tag> tags, Duration[] buckets) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.tags = Tags.of(tags);
        this.buckets = buckets;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return lookup("get", () -> delegate.get(key));
    }

    @Override
    public Optional<byte[]> getCached(String key, Duration nearCacheTtl) {
        return lookup("get", () -> delegate.getCached(key, nearCacheTtl));
    }

    @Override
    public Optional<byte[]> getAndExpire(String key, Duration ttl) {
        return lookup("getex", () -> delegate.getAndExpire(key, ttl));
    }

    @Override
    public List<byte[]> multiGet(List<String> keys) {
        return multiLookup(() -> delegate.multiGet(keys));
    }

    @Override
    public List<byte[]> multiGetCached(List<String> keys, Duration nearCacheTtl) {
        return multiLookup(() -> delegate.multiGetCached(keys, nearCacheTtl));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        record("set", () -> {
            delegate.set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, byte[] value, Duration ttl) {
        return record("setnx", () -> delegate.setIfAbsent(key, value, ttl));
    }

    @Override
    public boolean setIfPresent(String key, byte[] value, Duration ttl) {
        return record("setxx", () -> delegate.setIfPresent(key, value, ttl));
    }

    @Override
    public void multiSet(Map<String, byte[]> values, Duration ttl) {
        record("mset", () -> {
            delegate.multiSet(values, ttl);
            return null;
        });
    }

    @Override
    public long delete(Collection<String> keys) {
        return record("del", () -> delegate.delete(keys));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        return record("pttl", () -> delegate.ttl(key));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return record("pexpire", () -> delegate.expire(key, ttl));
    }

    @Override
    public boolean compareAndSet(String key, byte[] expected, byte[] value, Duration ttl) {
        return record("cas", () -> delegate.compareAndSet(key, expected, value, ttl));
    }

    @Override
    public boolean ping() {
        return record("ping", delegate::ping);
    }

    private Optional<byte[]> lookup(String command, Supplier<Optional<byte[]>> call) {
        Optional<byte[]> result = record(command, call);
        countLookup(command, result.isPresent() ? 1 : 0, result.isPresent() ? 0 : 1);
        return result;
    }

    private List<byte[]> multiLookup(Supplier<List<byte[]>> call) {
        List<byte[]> result = record("mget", call);
        long hits = result.stream().filter(Objects::nonNull).count();
        countLookup("mget", hits, result.size() - hits);
        return result;
    }

    private void countLookup(String command, long hits, long misses) {
        CommandMeters meters = meters(command);
        if (hits > 0) {
            meters.hits.increment(hits);
        }
        if (misses > 0) {
            meters.misses.increment(misses);
        }
    }

    private <R> R record(String command, Supplier<R> call) {
        CommandMeters meters = meters(command);
        long start = System.nanoTime();
        boolean failed = false;
        try {
            return call.get();
        } catch (RuntimeException e) {
            failed = true;
            meters.errors.increment();
            throw e;
        } finally {
            (failed ? meters.errorDuration : meters.successDuration)
                .record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
    }

    private CommandMeters meters(String command) {
        return commandMeters.computeIfAbsent(command,
            name -> new CommandMeters(meterRegistry, name, tags, buckets));
    }

    private static final class CommandMeters {

        private final Timer successDuration;
        private final Timer errorDuration;
        private final Counter errors;
        private final Counter hits;
        private final Counter misses;

        private CommandMeters(MeterRegistry meterRegistry, String command, Tags tags, Duration[] buckets) {
            Tags commandTags = tags.and("command", command);
            this.successDuration = duration(meterRegistry, commandTags, "success", buckets);
            this.errorDuration = duration(meterRegistry, commandTags, "error", buckets);
            this.errors = Counter.builder("cache.command.errors")
                .description("Count of failed cache store commands")
                .tags(commandTags)
                .register(meterRegistry);
            this.hits = Counter.builder("cache.command.hits")
                .description("Count of keys found by cache store reads")
                .tags(commandTags)
                .register(meterRegistry);
            this.misses = Counter.builder("cache.command.misses")
                .description("Count of keys missing from cache store reads")
                .tags(commandTags)
                .register(meterRegistry);
        }

        private static Timer duration(MeterRegistry meterRegistry, Tags tags, String outcome, Duration[] buckets) {
            return Timer.builder("cache.command.duration")
                .description("Duration of cache store commands")
                .tags(tags)
                .tag("outcome", outcome)
                .serviceLevelObjectives(buckets)
                .register(meterRegistry);
        }
    }
}
