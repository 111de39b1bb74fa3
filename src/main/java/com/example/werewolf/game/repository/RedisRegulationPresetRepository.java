package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.Regulation;
import com.example.werewolf.global.config.GameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 프리셋 전체를 Redis 해시 하나에 담는다. 필드는 프리셋 이름, 값은 레귤레이션 JSON.
 * 프리셋은 게임보다 오래 쓰므로 TTL 을 두지 않는다.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "werewolf.persistence", name = "type", havingValue = "redis")
public class RedisRegulationPresetRepository implements RegulationPresetRepository {

    private final RedisTemplate<String, Regulation> regulationRedisTemplate;
    private final String key;

    public RedisRegulationPresetRepository(RedisTemplate<String, Regulation> regulationRedisTemplate,
                                           GameProperties properties) {
        this.regulationRedisTemplate = regulationRedisTemplate;
        this.key = properties.getPersistence().getPresetKey();
    }

    private HashOperations<String, String, Regulation> hash() {
        return regulationRedisTemplate.opsForHash();
    }

    @Override
    public void save(String name, Regulation regulation) {
        hash().put(key, name, regulation);
        log.info("Regulation preset saved to redis: key={}, name={}", key, name);
    }

    @Override
    public Optional<Regulation> findByName(String name) {
        return Optional.ofNullable(hash().get(key, name));
    }

    @Override
    public Map<String, Regulation> findAll() {
        return new TreeMap<>(hash().entries(key));
    }

    @Override
    public boolean delete(String name) {
        Long removed = hash().delete(key, name);
        return removed != null && removed > 0;
    }
}
