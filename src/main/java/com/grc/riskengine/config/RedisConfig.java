package com.grc.riskengine.config;

import com.grc.riskengine.dedup.DedupeRecord;
import com.grc.riskengine.dedup.DedupeRecordRedisSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the dedupe-key cache. Values are plain JSON {@link DedupeRecord}s.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, DedupeRecord> dedupeRecordRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, DedupeRecord> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new DedupeRecordRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
