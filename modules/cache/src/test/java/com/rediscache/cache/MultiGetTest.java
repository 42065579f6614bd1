package com.rediscache.cache;

import com.rediscache.cache.store.InMemoryCacheStore;
import com.rediscache.support.error.CacheErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MultiGetTest {

    record Person(String name, int age) {
    }

    private InMemoryCacheStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        DefaultCacheTemplate seed = new DefaultCacheTemplate(store);
        seed.set("k1", new Person("Bob", 45), Duration.ZERO);
        seed.set("k2", new Person("Alice", 30), Duration.ZERO);
        seed.set("k3", new Person("Carol", 27), Duration.ZERO);
    }

    private DefaultCacheTemplate templateWithBatchSize(int batchSize) {
        return new DefaultCacheTemplate(store, CacheOptions.builder().batchSize(batchSize).build());
    }

    @DisplayName("배치 크기와 관계없이 결과는 요청한 키 순서를 유지한다.")
    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 10})
    void preservesOrder(int batchSize) {
        // act
        MultiResult<Person> result = templateWithBatchSize(batchSize)
            .mGet(List.of("k3", "missing", "k1", "k2"), Person.class);

        // assert
        assertThat(result.results())
            .extracting(KeyResult::key)
            .containsExactly("k3", "missing", "k1", "k2");
        assertThat(result.results())
            .extracting(KeyResult::status)
            .containsExactly(KeyResult.Status.FOUND, KeyResult.Status.NOT_FOUND,
                KeyResult.Status.FOUND, KeyResult.Status.FOUND);
        assertThat(result.get("k3")).hasValueSatisfying(r -> assertThat(r.value().name()).isEqualTo("Carol"));
    }

    @DisplayName("배치 크기가 1이면 키마다 한 번씩 요청하고, 0이면 한 번에 요청한다.")
    @Test
    void requestsPerBatch() {
        // act
        templateWithBatchSize(1).mGet(List.of("k1", "k2", "k3"), Person.class);
        templateWithBatchSize(0).mGet(List.of("k1", "k2", "k3"), Person.class);

        // assert
        assertThat(store.multiGetRequests()).containsExactly(
            List.of("k1"), List.of("k2"), List.of("k3"),
            List.of("k1", "k2", "k3"));
    }

    @DisplayName("배치 크기로 나누면 마지막 묶음만 작을 수 있다.")
    @Test
    void partitionKeepsContiguousChunks() {
        assertThat(DefaultCacheTemplate.partition(List.of("a", "b", "c", "d", "e"), 2))
            .containsExactly(List.of("a", "b"), List.of("c", "d"), List.of("e"));
    }

    @DisplayName("중복 키는 요청한 위치마다 결과가 반복된다.")
    @Test
    void duplicateKeys() {
        // act
        MultiResult<Person> result = templateWithBatchSize(0).mGet(List.of("k1", "k1", "k2"), Person.class);

        // assert
        assertThat(result.size()).isEqualTo(3);
        assertThat(result.results()).extracting(KeyResult::key).containsExactly("k1", "k1", "k2");
        assertThat(result.values()).containsOnlyKeys("k1", "k2");
    }

    @DisplayName("한 키가 손상되어도 다른 키의 결과는 영향을 받지 않는다.")
    @Test
    void corruptedValueIsIsolated() {
        // arrange
        store.putRaw("k2", "corrupted".getBytes(StandardCharsets.UTF_8));

        // act
        MultiResult<Person> result = templateWithBatchSize(0).mGet(List.of("k1", "k2", "k3"), Person.class);

        // assert
        assertThat(result.get("k2")).hasValueSatisfying(r -> {
            assertThat(r.status()).isEqualTo(KeyResult.Status.DECODE_ERROR);
            assertThat(r.error().is(CacheErrorType.DATA_CORRUPTION)).isTrue();
            assertThat(r.error().getKey()).isEqualTo("k2");
        });
        assertThat(result.foundKeys()).containsExactly("k1", "k3");
    }

    @DisplayName("빈 키 목록은 저장소를 호출하지 않고 빈 결과를 반환한다.")
    @Test
    void emptyKeys() {
        // act
        MultiResult<Person> result = templateWithBatchSize(0).mGet(List.of(), Person.class);

        // assert
        assertThat(result.size()).isZero();
        assertThat(store.multiGetRequests()).isEmpty();
    }
}
