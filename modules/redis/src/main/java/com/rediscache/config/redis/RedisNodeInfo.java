package com.rediscache.config.redis;

public record RedisNodeInfo(
    String host,
    int port
) {
}
