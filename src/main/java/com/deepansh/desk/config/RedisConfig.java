package com.deepansh.desk.config;

import com.deepansh.desk.session.RedisSessionStore;
import com.deepansh.desk.session.SessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis session storage, active only when desk.session.store=redis.
 */
@Configuration
@ConditionalOnProperty(prefix = "desk.session", name = "store", havingValue = "redis")
@Slf4j
public class RedisConfig {

    /**
     * StringRedisTemplate: sessions are stored as plain JSON strings,
     * serialized by the application's ObjectMapper.
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(factory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new StringRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public SessionStore redisSessionStore(StringRedisTemplate stringRedisTemplate,
                                          ObjectMapper objectMapper,
                                          DeskProperties properties) {
        Duration ttl = Duration.ofHours(properties.getSession().getRedisTtlHours());
        log.info("Session store: redis [ttl={}h]", ttl.toHours());
        return new RedisSessionStore(stringRedisTemplate, objectMapper, ttl);
    }
}
