package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.PlayerRole;
import com.example.werewolf.game.domain.Regulation;
import com.example.werewolf.global.config.GameProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisRegulationPresetRepositoryTest {

    private HashOperations<String, String, Regulation> ops;
    private RedisRegulationPresetRepository repository;

    private final Regulation classic = Regulation.of(Map.of(PlayerRole.WEREWOLF, 1, PlayerRole.SEER, 1,
            PlayerRole.VILLAGER, 3));

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        RedisTemplate<String, Regulation> template = mock(RedisTemplate.class);
        ops = mock(HashOperations.class);
        when(template.<String, Regulation>opsForHash()).thenReturn(ops);

        GameProperties properties = new GameProperties();
        properties.getPersistence().setPresetKey("test:regulations");
        repository = new RedisRegulationPresetRepository(template, properties);
    }

    @Test
    void save_putsPresetIntoHashField() {
        repository.save("classic", classic);

        verify(ops).put("test:regulations", "classic", classic);
    }

    @Test
    void findByName_readsHashField() {
        when(ops.get("test:regulations", "classic")).thenReturn(classic);

        assertThat(repository.findByName("classic")).contains(classic);
        assertThat(repository.findByName("missing")).isEmpty();
    }

    @Test
    void findAll_returnsEntriesSortedByName() {
        Map<String, Regulation> entries = new HashMap<>();
        entries.put("zeta", classic);
        entries.put("alpha", classic);
        when(ops.entries("test:regulations")).thenReturn(entries);

        assertThat(repository.findAll().keySet()).containsExactly("alpha", "zeta");
    }

    @Test
    void delete_reportsRemovedFieldCount() {
        when(ops.delete("test:regulations", "classic")).thenReturn(1L);
        when(ops.delete("test:regulations", "missing")).thenReturn(0L);

        assertThat(repository.delete("classic")).isTrue();
        assertThat(repository.delete("missing")).isFalse();
    }
}
