package com.rediscache.cache.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GzipCompressorTest {

    private final GzipCompressor compressor = new GzipCompressor();

    @DisplayName("압축한 바이트를 해제하면 원래 바이트와 같다.")
    @Test
    void roundTrip() throws IOException {
        // arrange
        byte[] original = "hello hello hello hello hello".repeat(20).getBytes(StandardCharsets.UTF_8);

        // act
        byte[] compressed = compressor.compress(original);
        byte[] restored = compressor.decompress(compressed);

        // assert
        assertThat(compressed.length).isLessThan(original.length);
        assertThat(GzipCompressor.isGzipped(compressed)).isTrue();
        assertThat(restored).isEqualTo(original);
    }

    @DisplayName("빈 입력은 빈 출력으로 변환된다.")
    @Test
    void emptyInput() throws IOException {
        assertThat(compressor.compress(new byte[0])).isEmpty();
        assertThat(compressor.decompress(new byte[0])).isEmpty();
    }

    @DisplayName("GZIP 헤더가 없는 입력은 해제하지 않고 그대로 반환한다.")
    @Test
    void passThroughUncompressed() throws IOException {
        byte[] plain = "{\"name\":\"Bob\"}".getBytes(StandardCharsets.UTF_8);

        assertThat(compressor.decompress(plain)).isEqualTo(plain);
    }

    @DisplayName("이미 압축된 입력을 다시 압축해도 한 번 해제하면 입력이 복원된다.")
    @Test
    void alreadyCompressedInput() throws IOException {
        // arrange
        byte[] once = compressor.compress("payload".getBytes(StandardCharsets.UTF_8));

        // act
        byte[] twice = compressor.compress(once);

        // assert
        assertThat(compressor.decompress(twice)).isEqualTo(once);
    }

    @DisplayName("GZIP 헤더는 있지만 본문이 손상된 입력은 IOException이 발생한다.")
    @Test
    void corruptedInput() {
        byte[] corrupted = {(byte) 0x1f, (byte) 0x8b, 0x08, 0x00, 0x01, 0x02};

        assertThatThrownBy(() -> compressor.decompress(corrupted))
            .isInstanceOf(IOException.class);
    }
}
