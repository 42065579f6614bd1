package com.rediscache.config.redis;

import com.rediscache.cache.CacheOptions;
import com.rediscache.cache.CacheTemplate;
import com.rediscache.cache.DefaultCacheTemplate;
import com.rediscache.cache.codec.GzipCompressor;
import com.rediscache.cache.codec.JacksonCodec;
import com.rediscache.cache.hook.CacheHook;
import com.rediscache.cache.metrics.MetricsHook;
import com.rediscache.cache.store.CacheStore;
import com.rediscache.support.error.CacheException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.Ordered;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CacheTemplateConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(CacheTemplateConfig.class)
        .withBean(CacheStore.class, () -> mock(CacheStore.class));

    static class FirstHook implements CacheHook, Ordered {
        @Override
        public int getOrder() {
            return 1;
        }
    }

    static class SecondHook implements CacheHook, Ordered {
        @Override
        public int getOrder() {
            return 2;
        }
    }

    @DisplayName("설정이 없으면 기본값으로 캐시 템플릿을 만든다.")
    @Test
    void defaults() {
        contextRunner.run(context -> {
            // assert
            assertThat(context).hasSingleBean(CacheTemplate.class);
            CacheOptions options = context.getBean(CacheOptions.class);
            assertThat(options.getCodec()).isInstanceOf(JacksonCodec.class);
            assertThat(options.getCompressor().enabled()).isFalse();
            assertThat(options.getBatchSize()).isZero();
            assertThat(options.nearCacheEnabled()).isFalse();
            assertThat(options.getUpsertMaxAttempts()).isEqualTo(1);
            assertThat(options.getUpsertBackoff()).isEqualTo(Duration.ofMillis(10));
        });
    }

    @DisplayName("프로퍼티로 압축, 묶음 크기, near-cache, Upsert 재시도를 설정한다.")
    @Test
    void bindsProperties() {
        contextRunner
            .withPropertyValues(
                "cache.codec=cbor",
                "cache.compression=gzip",
                "cache.batch-size=50",
                "cache.near-cache-ttl=1s",
                "cache.upsert.max-attempts=3",
                "cache.upsert.backoff=5ms")
            .run(context -> {
                // assert
                CacheOptions options = context.getBean(CacheOptions.class);
                assertThat(options.getCompressor()).isInstanceOf(GzipCompressor.class);
                assertThat(options.getBatchSize()).isEqualTo(50);
                assertThat(options.getNearCacheTtl()).isEqualTo(Duration.ofSeconds(1));
                assertThat(options.getUpsertMaxAttempts()).isEqualTo(3);
                assertThat(options.getUpsertBackoff()).isEqualTo(Duration.ofMillis(5));
            });
    }

    @DisplayName("훅 빈은 순서대로 등록된다.")
    @Test
    void hooksInOrder() {
        contextRunner
            .withBean(SecondHook.class, SecondHook::new)
            .withBean(FirstHook.class, FirstHook::new)
            .run(context -> {
                // assert
                assertThat(context.getBean(CacheOptions.class).getHooks())
                    .extracting(hook -> hook.getClass().getSimpleName())
                    .containsExactly("FirstHook", "SecondHook");
            });
    }

    @DisplayName("MeterRegistry가 있으면 메트릭 훅을 마지막에 추가한다.")
    @Test
    void metricsEnabled() {
        contextRunner
            .withBean(FirstHook.class, FirstHook::new)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> {
                // assert
                DefaultCacheTemplate cacheTemplate = (DefaultCacheTemplate) context.getBean(CacheTemplate.class);
                assertThat(cacheTemplate.options().getHooks())
                    .hasSize(2)
                    .last().isInstanceOf(MetricsHook.class);
            });
    }

    @DisplayName("메트릭을 비활성화하면 MeterRegistry가 있어도 메트릭 훅을 추가하지 않는다.")
    @Test
    void metricsDisabled() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withPropertyValues("cache.metrics.enabled=false")
            .run(context -> {
                // assert
                DefaultCacheTemplate cacheTemplate = (DefaultCacheTemplate) context.getBean(CacheTemplate.class);
                assertThat(cacheTemplate.options().getHooks()).isEmpty();
            });
    }

    @DisplayName("잘못된 설정이면 컨텍스트 시작에 실패한다.")
    @Test
    void invalidOptions() {
        contextRunner
            .withPropertyValues("cache.upsert.max-attempts=0")
            .run(context -> assertThat(context)
                .hasFailed()
                .getFailure()
                .hasRootCauseInstanceOf(CacheException.class));
    }
}
