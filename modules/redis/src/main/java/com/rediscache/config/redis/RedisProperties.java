package com.rediscache.config.redis;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Redis 연결 설정.
 *
 * @param database 데이터베이스 번호
 * @param master 마스터 노드
 * @param replicas 레플리카 노드 (없으면 마스터에서 읽음)
 * @param commandTimeout 명령 타임아웃. 초과하면 {@code TIMEOUT}으로 실패합니다.
 */
@ConfigurationProperties(value = "datasource.redis")
public record RedisProperties(
    @DefaultValue("0") int database,
    RedisNodeInfo master,
    List<RedisNodeInfo> replicas,
    @DefaultValue("2s") Duration commandTimeout
) {

    public RedisProperties {
        replicas = replicas == null ? List.of() : List.copyOf(replicas);
    }
}
