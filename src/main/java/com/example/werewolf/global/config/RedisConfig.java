package com.example.werewolf.global.config;

import com.example.werewolf.game.domain.Regulation;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * werewolf.persistence.type=redis 일 때만 등록된다.
 * 스냅샷은 Boot 가 만든 StringRedisTemplate 을 쓰고, 레귤레이션 프리셋은 해시 하나에 JSON 으로 담는다.
 */
@Configuration
@ConditionalOnProperty(prefix = "werewolf.persistence", name = "type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisTemplate<String, Regulation> regulationRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                     ObjectMapper objectMapper) {
        RedisTemplate<String, Regulation> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(connectionFactory);
        redisTemplate.setKeySerializer(new StringRedisSerializer());

        Jackson2JsonRedisSerializer<Regulation> jsonSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, Regulation.class);
        redisTemplate.setValueSerializer(jsonSerializer);
        redisTemplate.setHashKeySerializer(new StringRedisSerializer());
        redisTemplate.setHashValueSerializer(jsonSerializer);

        return redisTemplate;
    }
}
