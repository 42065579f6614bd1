package com.rediscache.cache.metrics;

import com.rediscache.cache.codec.ByteTransformer;
import com.rediscache.cache.codec.Marshaller;
import com.rediscache.cache.codec.Unmarshaller;
import com.rediscache.cache.hook.CacheHook;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 직렬화/압축 소요 시간과 오류 수를 기록하는 관찰형 훅.
 * <p>
 * 감싼 함수의 결과와 예외를 바꾸지 않고 그대로 전달합니다.
 * </p>
 * <p>
 * <b>메트릭:</b>
 * <ul>
 *   <li>{@code cache.serialization.duration} (operation=marshal|unmarshal)</li>
 *   <li>{@code cache.serialization.errors} (operation=marshal|unmarshal)</li>
 *   <li>{@code cache.compression.duration} (operation=compress|decompress)</li>
 *   <li>{@code cache.compression.errors} (operation=compress|decompress)</li>
 * </ul>
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public class MetricsHook implements CacheHook {

    private final StageMeters marshal;
    private final StageMeters unmarshal;
    private final StageMeters compress;
    private final StageMeters decompress;

    public MetricsHook(MeterRegistry meterRegistry) {
        this(meterRegistry, Tags.empty(), MetricsBuckets.DEFAULT_PIPELINE_BUCKETS);
    }

    public MetricsHook(MeterRegistry meterRegistry, Iterable<Tag> tags, Duration[] buckets) {
        this.marshal = new StageMeters(meterRegistry, "cache.serialization", "marshal", tags, buckets);
        this.unmarshal = new StageMeters(meterRegistry, "cache.serialization", "unmarshal", tags, buckets);
        this.compress = new StageMeters(meterRegistry, "cache.compression", "compress", tags, buckets);
        this.decompress = new StageMeters(meterRegistry, "cache.compression", "decompress", tags, buckets);
    }

    @Override
    public Marshaller marshalHook(Marshaller next) {
        return value -> {
            long start = System.nanoTime();
            try {
                return next.marshal(value);
            } catch (IOException | RuntimeException e) {
                marshal.errors.increment();
                throw e;
            } finally {
                marshal.record(start);
            }
        };
    }

    @Override
    public Unmarshaller unmarshalHook(Unmarshaller next) {
        return (data, type) -> {
            long start = System.nanoTime();
            try {
                return next.unmarshal(data, type);
            } catch (IOException | RuntimeException e) {
                unmarshal.errors.increment();
                throw e;
            } finally {
                unmarshal.record(start);
            }
        };
    }

    @Override
    public ByteTransformer compressHook(ByteTransformer next) {
        return instrument(next, compress);
    }

    @Override
    public ByteTransformer decompressHook(ByteTransformer next) {
        return instrument(next, decompress);
    }

    private static ByteTransformer instrument(ByteTransformer next, StageMeters meters) {
        return data -> {
            long start = System.nanoTime();
            try {
                return next.apply(data);
            } catch (IOException | RuntimeException e) {
                meters.errors.increment();
                throw e;
            } finally {
                meters.record(start);
            }
        };
    }

    private static final class StageMeters {

        private final Timer duration;
        private final Counter errors;

        private StageMeters(MeterRegistry meterRegistry, String prefix, String operation,
                            Iterable<Tag> tags, Duration[] buckets) {
            this.duration = Timer.builder(prefix + ".duration")
                .description("Duration of cache " + operation + " operations")
                .tags(tags)
                .tag("operation", operation)
                .serviceLevelObjectives(buckets)
                .register(meterRegistry);
            this.errors = Counter.builder(prefix + ".errors")
                .description("Count of cache " + operation + " failures")
                .tags(tags)
                .tag("operation", operation)
                .register(meterRegistry);
        }

        private void record(long startNanos) {
            duration.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }
}
