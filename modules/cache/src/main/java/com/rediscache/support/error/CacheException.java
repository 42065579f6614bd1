package com.rediscache.support.error;

import com.rediscache.cache.codec.PipelineStage;
import lombok.Getter;

/**
 * 캐시 예외.
 * <p>
 * 모든 파이프라인/저장소 오류는 이 예외로 감싸져 호출자에게 전달됩니다.
 * {@link #getErrorType()}으로 분류를, {@link #getOperation()}, {@link #getKey()},
 * {@link #getStage()}로 발생 위치를 확인할 수 있습니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
@Getter
public class CacheException extends RuntimeException {

    private final CacheErrorType errorType;
    private final String customMessage;
    private final String operation;
    private final String key;
    private final PipelineStage stage;

    public CacheException(CacheErrorType errorType) {
        this(errorType, null, null, null, null, null);
    }

    public CacheException(CacheErrorType errorType, String customMessage) {
        this(errorType, customMessage, null, null, null, null);
    }

    public CacheException(CacheErrorType errorType, String customMessage, Throwable cause) {
        this(errorType, customMessage, null, null, null, cause);
    }

    public CacheException(
        CacheErrorType errorType,
        String customMessage,
        String operation,
        String key,
        PipelineStage stage,
        Throwable cause
    ) {
        super(buildMessage(errorType, customMessage, operation, key, stage), cause);
        this.errorType = errorType;
        this.customMessage = customMessage;
        this.operation = operation;
        this.key = key;
        this.stage = stage;
    }

    /**
     * 키가 존재하지 않음을 나타내는 예외를 생성합니다.
     *
     * @param operation 연산 이름
     * @param key 캐시 키
     * @return 예외
     */
    public static CacheException keyNotFound(String operation, String key) {
        return new CacheException(CacheErrorType.KEY_NOT_FOUND, null, operation, key, null, null);
    }

    /**
     * 에러 유형이 주어진 유형과 같거나 더 구체적인지 확인합니다.
     *
     * @param type 비교할 유형
     * @return 같거나 하위 유형이면 true
     */
    public boolean is(CacheErrorType type) {
        return errorType.is(type);
    }

    /**
     * 연산/키 문맥을 채운 예외를 반환합니다.
     * <p>
     * 이미 문맥이 있으면 그대로 반환합니다.
     * </p>
     *
     * @param operation 연산 이름
     * @param key 캐시 키
     * @return 문맥이 채워진 예외
     */
    public CacheException withContext(String operation, String key) {
        if (this.operation != null) {
            return this;
        }
        CacheException wrapped = new CacheException(errorType, customMessage, operation, key, stage, getCause());
        wrapped.setStackTrace(getStackTrace());
        return wrapped;
    }

    private static String buildMessage(
        CacheErrorType errorType,
        String customMessage,
        String operation,
        String key,
        PipelineStage stage
    ) {
        StringBuilder builder = new StringBuilder(customMessage != null ? customMessage : errorType.getMessage());
        if (operation != null) {
            builder.append(" (operation: ").append(operation);
            if (key != null) {
                builder.append(", key: ").append(key);
            }
            if (stage != null) {
                builder.append(", stage: ").append(stage);
            }
            builder.append(")");
        } else if (stage != null) {
            builder.append(" (stage: ").append(stage).append(")");
        }
        return builder.toString();
    }
}
