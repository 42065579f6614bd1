package com.rediscache.config.redis;

import com.rediscache.cache.redis.RedisCacheStore;
import io.lettuce.core.ReadFrom;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisStaticMasterReplicaConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.util.List;
import java.util.function.Consumer;

/**
 * Redis 연결과 캐시 저장소 설정.
 * <p>
 * 기본 연결은 레플리카 우선으로 읽고, 마스터 연결은 쓰기와 CAS, 정합성이 필요한 조회에 사용합니다.
 * 값은 캐시 파이프라인이 만든 바이트를 그대로 저장합니다.
 * </p>
 *
 * @author Loopers
 * @version 1.0
 */
@Configuration
@EnableConfigurationProperties({RedisProperties.class, CacheProperties.class})
public class RedisConfig {
    private static final String CONNECTION_MASTER = "redisConnectionMaster";
    public static final String REDIS_TEMPLATE_MASTER = "redisTemplateMaster";

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    @Primary
    @Bean
    public LettuceConnectionFactory defaultRedisConnectionFactory() {
        return lettuceConnectionFactory(b -> b.readFrom(ReadFrom.REPLICA_PREFERRED));
    }

    @Qualifier(CONNECTION_MASTER)
    @Bean
    public LettuceConnectionFactory masterRedisConnectionFactory() {
        return lettuceConnectionFactory(b -> b.readFrom(ReadFrom.MASTER));
    }

    @Primary
    @Bean
    public RedisTemplate<String, byte[]> defaultRedisTemplate(LettuceConnectionFactory lettuceConnectionFactory) {
        return byteArrayRedisTemplate(lettuceConnectionFactory);
    }

    @Qualifier(REDIS_TEMPLATE_MASTER)
    @Bean
    public RedisTemplate<String, byte[]> masterRedisTemplate(
            @Qualifier(CONNECTION_MASTER) LettuceConnectionFactory lettuceConnectionFactory
    ) {
        return byteArrayRedisTemplate(lettuceConnectionFactory);
    }

    @Bean
    public RedisCacheStore redisCacheStore(
            RedisTemplate<String, byte[]> defaultRedisTemplate,
            @Qualifier(REDIS_TEMPLATE_MASTER) RedisTemplate<String, byte[]> masterRedisTemplate,
            CacheProperties cacheProperties
    ) {
        return new RedisCacheStore(defaultRedisTemplate, masterRedisTemplate, cacheProperties.nearCacheMaxSize());
    }

    private LettuceConnectionFactory lettuceConnectionFactory(
            Consumer<LettuceClientConfiguration.LettuceClientConfigurationBuilder> customizer
    ) {
        LettuceClientConfiguration.LettuceClientConfigurationBuilder builder = LettuceClientConfiguration.builder()
            .commandTimeout(redisProperties.commandTimeout());
        customizer.accept(builder);
        LettuceClientConfiguration clientConfig = builder.build();

        RedisNodeInfo master = redisProperties.master();
        RedisStaticMasterReplicaConfiguration masterReplicaConfig =
            new RedisStaticMasterReplicaConfiguration(master.host(), master.port());
        masterReplicaConfig.setDatabase(redisProperties.database());
        List<RedisNodeInfo> replicas = redisProperties.replicas();
        for (RedisNodeInfo r : replicas) {
            masterReplicaConfig.addNode(r.host(), r.port());
        }
        return new LettuceConnectionFactory(masterReplicaConfig, clientConfig);
    }

    private RedisTemplate<String, byte[]> byteArrayRedisTemplate(LettuceConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        StringRedisSerializer s = new StringRedisSerializer();
        template.setKeySerializer(s);
        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashKeySerializer(s);
        template.setHashValueSerializer(RedisSerializer.byteArray());
        template.setConnectionFactory(connectionFactory);
        return template;
    }
}
