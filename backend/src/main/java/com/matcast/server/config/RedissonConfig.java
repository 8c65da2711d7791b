package com.matcast.server.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.redisson.config.Config;

/**
 * Redisson client for the cross-process match lock. Only created when
 * {@code matcast.match.distributed-lock.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "matcast.match.distributed-lock.enabled", havingValue = "true")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(@Value("${spring.data.redis.url:redis://localhost:6379}") String redisUrl) {
        Config config = new Config();

        if (redisUrl == null || redisUrl.isEmpty()) {
            redisUrl = "redis://localhost:6379";
        }

        config.useSingleServer()
              .setAddress(redisUrl);

        return Redisson.create(config);
    }
}
