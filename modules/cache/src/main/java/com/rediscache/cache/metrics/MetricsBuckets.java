package com.rediscache.cache.metrics;

import java.time.Duration;

/**
 * 히스토그램 버킷 경계 생성 유틸리티.
 *
 * @author Loopers
 * @version 1.0
 */
public final class MetricsBuckets {

    /** 1ms, 2ms, 4ms ... 512ms */
    public static final Duration[] DEFAULT_COMMAND_BUCKETS = exponential(Duration.ofMillis(1), 2, 10);

    /** 1ms, 2ms, 4ms, 8ms, 16ms */
    public static final Duration[] DEFAULT_PIPELINE_BUCKETS = exponential(Duration.ofMillis(1), 2, 5);

    private MetricsBuckets() {
    }

    /**
     * 지수적으로 증가하는 버킷 경계를 생성합니다.
     *
     * @param start 첫 경계 (0보다 커야 함)
     * @param factor 배수 (1보다 커야 함)
     * @param count 경계 수 (1 이상)
     * @return {@code start * factor^i} (i = 0 .. count-1)
     */
    public static Duration[] exponential(Duration start, double factor, int count) {
        if (start == null || start.isZero() || start.isNegative()) {
            throw new IllegalArgumentException("start는 0보다 커야 합니다: " + start);
        }
        if (factor <= 1) {
            throw new IllegalArgumentException("factor는 1보다 커야 합니다: " + factor);
        }
        if (count < 1) {
            throw new IllegalArgumentException("count는 1 이상이어야 합니다: " + count);
        }

        Duration[] buckets = new Duration[count];
        double nanos = start.toNanos();
        for (int i = 0; i < count; i++) {
            buckets[i] = Duration.ofNanos(Math.round(nanos));
            nanos *= factor;
        }
        return buckets;
    }
}
