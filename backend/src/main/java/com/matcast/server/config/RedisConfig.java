package com.matcast.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pub/sub listener container for the broker bridge. The connection factory
 * and {@code StringRedisTemplate} come from Spring Boot's Redis
 * auto-configuration ({@code spring.data.redis.url}).
 *
 * Subscriptions are added lazily by the bridge, so the container starts
 * fine with Redis down.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(brokerListenerExecutor());
        return container;
    }

    /**
     * Threads that run broker deliveries into the hub's local fan-out.
     */
    @Bean
    public ThreadPoolTaskExecutor brokerListenerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix("broker-rx-");
        executor.setDaemon(true);
        return executor;
    }
}
