package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.snapshot.GameSnapshot;
import com.example.werewolf.global.config.GameProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * 스냅샷을 JSON 문자열로 Redis 키 하나에 저장한다.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "werewolf.persistence", name = "type", havingValue = "redis")
public class RedisSnapshotRepository implements SnapshotRepository {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String key;
    private final Duration ttl;

    public RedisSnapshotRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                   GameProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.key = properties.getPersistence().getRedisKey();
        this.ttl = properties.getPersistence().getTtl();
    }

    @Override
    public void save(GameSnapshot snapshot) {
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(key, json, ttl);
            log.info("Snapshot saved to redis: key={}, round={}", key, snapshot.round());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot", e);
        }
    }

    @Override
    public Optional<GameSnapshot> load() {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, GameSnapshot.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize snapshot from key " + key, e);
        }
    }

    @Override
    public void delete() {
        redisTemplate.delete(key);
    }
}
