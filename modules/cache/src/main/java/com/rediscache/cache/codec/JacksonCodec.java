package com.rediscache.cache.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson 기반 코덱.
 * <p>
 * {@link #json()}은 사람이 읽을 수 있는 JSON을, {@link #cbor()}는 더 작은 바이너리 표현(CBOR)을 사용합니다.
 * 주어진 {@link ObjectMapper}를 그대로 사용하므로 호출자가 모듈과 기능을 직접 구성할 수도 있습니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public class JacksonCodec implements Codec {

    private final ObjectMapper objectMapper;

    public JacksonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * JSON 코덱을 생성합니다.
     *
     * @return JSON 코덱
     */
    public static JacksonCodec json() {
        return new JacksonCodec(configure(new ObjectMapper()));
    }

    /**
     * CBOR 코덱을 생성합니다.
     *
     * @return CBOR 코덱
     */
    public static JacksonCodec cbor() {
        return new JacksonCodec(configure(new CBORMapper()));
    }

    @Override
    public byte[] encode(Object value) throws IOException {
        return objectMapper.writeValueAsBytes(value);
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) throws IOException {
        return objectMapper.readValue(data, type);
    }

    private static ObjectMapper configure(ObjectMapper objectMapper) {
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }
}
