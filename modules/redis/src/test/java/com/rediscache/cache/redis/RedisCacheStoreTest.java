package com.rediscache.cache.redis;

import com.rediscache.support.error.CacheErrorType;
import com.rediscache.support.error.CacheException;
import io.lettuce.core.RedisCommandInterruptedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    private static final byte[] VALUE = "{\"name\":\"Bob\"}".getBytes(StandardCharsets.UTF_8);

    @Mock
    private RedisTemplate<String, byte[]> readTemplate;

    @Mock
    private RedisTemplate<String, byte[]> masterTemplate;

    @Mock
    private ValueOperations<String, byte[]> readOps;

    @Mock
    private ValueOperations<String, byte[]> masterOps;

    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCacheStore(readTemplate, masterTemplate, 100);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @DisplayName("Redis 예외를 변환할 때, ")
    @Nested
    class Translate {

        @DisplayName("명령 타임아웃은 TIMEOUT으로 변환된다.")
        @Test
        void timeout() {
            // arrange
            when(masterTemplate.opsForValue()).thenReturn(masterOps);
            when(masterOps.get("person")).thenThrow(new QueryTimeoutException("timed out"));

            // act & assert
            assertThatThrownBy(() -> store.get("person"))
                .isInstanceOfSatisfying(CacheException.class, e -> {
                    assertThat(e.getErrorType()).isEqualTo(CacheErrorType.TIMEOUT);
                    assertThat(e.getKey()).isEqualTo("person");
                });
        }

        @DisplayName("명령 대기 중 인터럽트는 CANCELLED로 변환된다.")
        @Test
        void interrupted() {
            // arrange
            when(masterTemplate.opsForValue()).thenReturn(masterOps);
            when(masterOps.get("person")).thenThrow(new RedisSystemException("interrupted",
                new RedisCommandInterruptedException(new InterruptedException())));

            // act & assert
            assertThatThrownBy(() -> store.get("person"))
                .isInstanceOfSatisfying(CacheException.class,
                    e -> assertThat(e.getErrorType()).isEqualTo(CacheErrorType.CANCELLED));
        }

        @DisplayName("연결 실패는 STORE_ERROR로 변환된다.")
        @Test
        void connectionFailure() {
            // arrange
            when(masterTemplate.opsForValue()).thenReturn(masterOps);
            when(masterOps.get("person")).thenThrow(new RedisConnectionFailureException("refused"));

            // act & assert
            assertThatThrownBy(() -> store.get("person"))
                .isInstanceOfSatisfying(CacheException.class, e -> {
                    assertThat(e.getErrorType()).isEqualTo(CacheErrorType.STORE_ERROR);
                    assertThat(e.getCause()).isInstanceOf(RedisConnectionFailureException.class);
                });
        }
    }

    @DisplayName("TTL을 조회할 때, ")
    @Nested
    class Ttl {

        @DisplayName("키가 없으면(-2) empty를 반환한다.")
        @Test
        void absent() {
            when(masterTemplate.getExpire("key", TimeUnit.MILLISECONDS)).thenReturn(-2L);

            assertThat(store.ttl("key")).isEmpty();
        }

        @DisplayName("만료가 없으면(-1) ZERO를 반환한다.")
        @Test
        void noExpiry() {
            when(masterTemplate.getExpire("key", TimeUnit.MILLISECONDS)).thenReturn(-1L);

            assertThat(store.ttl("key")).contains(Duration.ZERO);
        }

        @DisplayName("남은 시간을 밀리초 단위로 반환한다.")
        @Test
        void remaining() {
            when(masterTemplate.getExpire("key", TimeUnit.MILLISECONDS)).thenReturn(1500L);

            assertThat(store.ttl("key")).contains(Duration.ofMillis(1500));
        }
    }

    @DisplayName("near-cache를 사용할 때, ")
    @Nested
    class NearCache {

        @DisplayName("TTL 안에서는 두 번째 조회를 레플리카 연결 없이 처리한다.")
        @Test
        void servesFromNearCache() {
            // arrange
            when(readTemplate.opsForValue()).thenReturn(readOps);
            when(readOps.get("person")).thenReturn(VALUE);

            // act
            store.getCached("person", Duration.ofMinutes(1));
            byte[] second = store.getCached("person", Duration.ofMinutes(1)).orElseThrow();

            // assert
            assertThat(second).isEqualTo(VALUE);
            verify(readOps, times(1)).get("person");
        }

        @DisplayName("이 저장소를 통한 쓰기는 near-cache를 무효화한다.")
        @Test
        void writeInvalidates() {
            // arrange
            when(readTemplate.opsForValue()).thenReturn(readOps);
            when(masterTemplate.opsForValue()).thenReturn(masterOps);
            when(readOps.get("person")).thenReturn(VALUE);

            // act
            store.getCached("person", Duration.ofMinutes(1));
            store.set("person", VALUE, Duration.ZERO);
            store.getCached("person", Duration.ofMinutes(1));

            // assert
            verify(readOps, times(2)).get("person");
            verify(masterOps).set("person", VALUE);
        }

        @DisplayName("없는 키는 near-cache에 저장하지 않는다.")
        @Test
        void missIsNotCached() {
            // arrange
            when(readTemplate.opsForValue()).thenReturn(readOps);
            when(readOps.get("missing")).thenReturn(null);

            // act
            store.getCached("missing", Duration.ofMinutes(1));
            store.getCached("missing", Duration.ofMinutes(1));

            // assert
            verify(readOps, times(2)).get("missing");
            assertThat(store.nearCache().estimatedSize()).isZero();
        }
    }

    @DisplayName("여러 키를 조회할 때, ")
    @Nested
    class MultiGet {

        @DisplayName("near-cache를 거치지 않는 조회는 마스터 연결을 사용한다.")
        @Test
        void uncachedReadsFromMaster() {
            // arrange
            when(masterTemplate.opsForValue()).thenReturn(masterOps);
            when(masterOps.multiGet(List.of("a", "b"))).thenReturn(Arrays.asList(VALUE, null));

            // act
            List<byte[]> values = store.multiGet(List.of("a", "b"));

            // assert
            assertThat(values).containsExactly(VALUE, null);
            verifyNoInteractions(readTemplate);
        }

        @DisplayName("near-cache 경유 조회는 미적중 키만 레플리카 우선 연결로 읽는다.")
        @Test
        void cachedMissesReadFromReplica() {
            // arrange
            when(readTemplate.opsForValue()).thenReturn(readOps);
            when(readOps.get("a")).thenReturn(VALUE);
            when(readOps.multiGet(List.of("b"))).thenReturn(Arrays.asList((byte[]) null));
            store.getCached("a", Duration.ofMinutes(1));

            // act
            List<byte[]> values = store.multiGetCached(List.of("a", "b"), Duration.ofMinutes(1));

            // assert
            assertThat(values).containsExactly(VALUE, null);
            verify(readOps).multiGet(List.of("b"));
            verifyNoInteractions(masterTemplate);
        }
    }

    @DisplayName("compare-and-set 스크립트를 실행할 때, ")
    @Nested
    class CompareAndSet {

        private final byte[] expected = "old".getBytes(StandardCharsets.UTF_8);
        private final byte[] value = "new".getBytes(StandardCharsets.UTF_8);

        @DisplayName("기대 값이 있으면 ARGV는 '0', 기대 바이트, 새 바이트, TTL(ms) 순서다.")
        @Test
        void expectedValueArguments() {
            // arrange
            when(masterTemplate.execute(casScript(), eq(List.of("counter")),
                aryEq(utf8("0")), aryEq(expected), aryEq(value), aryEq(utf8("1500"))))
                .thenReturn(1L);

            // act
            boolean written = store.compareAndSet("counter", expected, value, Duration.ofMillis(1500));

            // assert
            assertThat(written).isTrue();
        }

        @DisplayName("기대 값이 없으면 ARGV는 '1'과 빈 바이트로 시작하고, 충돌(0)은 false다.")
        @Test
        void expectAbsentArguments() {
            // arrange
            when(masterTemplate.execute(casScript(), eq(List.of("counter")),
                aryEq(utf8("1")), aryEq(new byte[0]), aryEq(value), aryEq(utf8("0"))))
                .thenReturn(0L);

            // act
            boolean written = store.compareAndSet("counter", null, value, Duration.ZERO);

            // assert
            assertThat(written).isFalse();
        }

        @DisplayName("1ms 미만의 TTL은 1ms로 올려서 전달한다.")
        @Test
        void subMillisecondTtlRoundsUp() {
            // arrange
            when(masterTemplate.execute(casScript(), eq(List.of("counter")),
                aryEq(utf8("0")), aryEq(expected), aryEq(value), aryEq(utf8("1"))))
                .thenReturn(1L);

            // act
            boolean written = store.compareAndSet("counter", expected, value, Duration.ofNanos(500_000));

            // assert
            assertThat(written).isTrue();
        }

        private RedisScript<Long> casScript() {
            return argThat(script -> CompareAndSetScript.SCRIPT.equals(script.getScriptAsString()));
        }

        private byte[] utf8(String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
    }
}
