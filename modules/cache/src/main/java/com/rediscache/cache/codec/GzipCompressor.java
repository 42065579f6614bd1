package com.rediscache.cache.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP Compressor.
 * <p>
 * 빈 입력은 빈 출력으로 변환하며, GZIP 헤더가 없는 입력은 해제하지 않고 그대로 반환합니다.
 * 압축 이전에 저장된 값도 읽을 수 있습니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
public class GzipCompressor implements Compressor {

    @Override
    public byte[] compress(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            return new byte[0];
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        }
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            return new byte[0];
        }

        if (!isGzipped(data)) {
            return data;
        }

        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return gzip.readAllBytes();
        }
    }

    static boolean isGzipped(byte[] data) {
        return data.length >= 2
            && data[0] == (byte) (GZIPInputStream.GZIP_MAGIC)
            && data[1] == (byte) (GZIPInputStream.GZIP_MAGIC >> 8);
    }
}
