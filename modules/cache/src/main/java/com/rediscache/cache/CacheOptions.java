package com.rediscache.cache;

import com.rediscache.cache.codec.Codec;
import com.rediscache.cache.codec.Compressor;
import com.rediscache.cache.codec.JacksonCodec;
import com.rediscache.cache.hook.CacheHook;
import com.rediscache.support.error.CacheErrorType;
import com.rediscache.support.error.CacheException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * 캐시 설정.
 * <p>
 * 생성 후 변경할 수 없습니다. 코덱을 바꾸려면 새 캐시를 만들어야 합니다.
 * </p>
 * <p>
 * <b>기본값:</b>
 * <ul>
 *   <li>codec: JSON</li>
 *   <li>compressor: 압축 없음</li>
 *   <li>batchSize: 0 (한 번의 요청으로 전체 조회)</li>
 *   <li>nearCacheTtl: 0 (near-cache 사용 안 함)</li>
 *   <li>upsertMaxAttempts: 1 (충돌 시 호출자가 재시도)</li>
 *   <li>upsertBackoff: 10ms</li>
 * </ul>
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class CacheOptions {

    @Builder.Default
    private final Codec codec = JacksonCodec.json();

    @Builder.Default
    private final Compressor compressor = Compressor.none();

    @Builder.Default
    private final int batchSize = 0;

    @Builder.Default
    private final Duration nearCacheTtl = Duration.ZERO;

    @Builder.Default
    private final int upsertMaxAttempts = 1;

    @Builder.Default
    private final Duration upsertBackoff = Duration.ofMillis(10);

    @Singular
    private final List<CacheHook> hooks;

    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }

    public boolean nearCacheEnabled() {
        return nearCacheTtl.compareTo(Duration.ZERO) > 0;
    }

    void validate() {
        if (codec == null || compressor == null) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "codec과 compressor는 필수입니다.");
        }
        if (batchSize < 0) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "batchSize는 0 이상이어야 합니다: " + batchSize);
        }
        if (nearCacheTtl == null || nearCacheTtl.isNegative()) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "nearCacheTtl은 0 이상이어야 합니다.");
        }
        if (upsertMaxAttempts < 1) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT,
                "upsertMaxAttempts는 1 이상이어야 합니다: " + upsertMaxAttempts);
        }
        if (upsertBackoff == null || upsertBackoff.toMillis() < 1) {
            throw new CacheException(CacheErrorType.INVALID_ARGUMENT, "upsertBackoff는 1ms 이상이어야 합니다.");
        }
    }
}
