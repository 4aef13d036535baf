package com.portfolioanalysis.optimizer.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the simulation session store.
 * Sessions are serialized to JSON by the store itself, so keys and values are plain strings.
 */
@Configuration
@ConditionalOnProperty(name = "portfolio.simulation.store", havingValue = "redis")
public class RedisConfig {

        @Bean(name = "simulationRedisTemplate")
        public RedisTemplate<String, String> simulationRedisTemplate(RedisConnectionFactory connectionFactory) {
                RedisTemplate<String, String> template = new RedisTemplate<>();
                template.setConnectionFactory(connectionFactory);

                template.setKeySerializer(new StringRedisSerializer());
                template.setValueSerializer(new StringRedisSerializer());
                template.setHashKeySerializer(new StringRedisSerializer());
                template.setHashValueSerializer(new StringRedisSerializer());

                template.afterPropertiesSet();
                return template;
        }
}
