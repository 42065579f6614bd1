package com.rediscache.cache.redis;

import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * 값 비교 후 쓰기(compare-and-set) Lua 스크립트.
 * <p>
 * GET, 비교, SET을 한 번의 스크립트 실행으로 처리하므로 다른 명령이 끼어들 수 없습니다.
 * </p>
 * <pre>
 * KEYS[1] = 대상 키
 * ARGV[1] = '1'이면 키가 없을 때만 쓰기, '0'이면 ARGV[2]와 같을 때만 쓰기
 * ARGV[2] = 기대하는 현재 바이트
 * ARGV[3] = 새 바이트
 * ARGV[4] = TTL(ms), 0이면 만료 없음
 * 반환: 1(쓰기 성공) / 0(충돌)
 * </pre>
 *
 * @author Loopers
 * @version 1.0
 */
public class CompareAndSetScript {

    static final String SCRIPT = """
        local current = redis.call('GET', KEYS[1])
        if ARGV[1] == '1' then
            if current then
                return 0
            end
        elseif (not current) or current ~= ARGV[2] then
            return 0
        end
        local ttl = tonumber(ARGV[4])
        if ttl > 0 then
            redis.call('SET', KEYS[1], ARGV[3], 'PX', ttl)
        else
            redis.call('SET', KEYS[1], ARGV[3])
        end
        return 1
        """;

    private static final byte[] EXPECT_ABSENT = "1".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPECT_VALUE = "0".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EMPTY = new byte[0];

    private final RedisScript<Long> script = new DefaultRedisScript<>(SCRIPT, Long.class);

    /**
     * 현재 값이 기대 값과 같을 때만 새 값을 씁니다.
     *
     * @param template 마스터 연결 템플릿
     * @param key 키
     * @param expected 기대하는 현재 바이트 (null이면 키가 없어야 함)
     * @param value 새 바이트
     * @param ttl TTL ({@link Duration#ZERO}이면 만료 없음)
     * @return 썼으면 true
     */
    public boolean execute(RedisTemplate<String, byte[]> template, String key, byte[] expected,
                           byte[] value, Duration ttl) {
        byte[] ttlMillis = Long.toString(ttl.toMillis()).getBytes(StandardCharsets.UTF_8);
        Long result = template.execute(script, List.of(key),
            expected == null ? EXPECT_ABSENT : EXPECT_VALUE,
            expected == null ? EMPTY : expected,
            value,
            ttlMillis);
        return result != null && result == 1L;
    }
}
