package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.GamePhase;
import com.example.werewolf.game.domain.GameResult;
import com.example.werewolf.game.domain.PlayerRole;
import com.example.werewolf.game.domain.PlayerStatus;
import com.example.werewolf.game.domain.Regulation;
import com.example.werewolf.game.domain.StatusRecord;
import com.example.werewolf.game.domain.snapshot.GameSnapshot;
import com.example.werewolf.game.domain.snapshot.PlayerSnapshot;
import com.example.werewolf.global.config.GameProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisSnapshotRepositoryTest {

    private StringRedisTemplate template;
    private ValueOperations<String, String> ops;
    private RedisSnapshotRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(StringRedisTemplate.class);
        ops = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(ops);

        GameProperties properties = new GameProperties();
        properties.getPersistence().setRedisKey("test:snapshot");
        properties.getPersistence().setTtl(Duration.ofMinutes(30));
        repository = new RedisSnapshotRepository(template, new ObjectMapper().findAndRegisterModules(), properties);
    }

    static GameSnapshot sample() {
        return GameSnapshot.builder()
                .phase(GamePhase.NIGHT)
                .round(2)
                .gameActive(false)
                .result(GameResult.WEREWOLF)
                .regulation(Regulation.of(Map.of(PlayerRole.WEREWOLF, 1, PlayerRole.VILLAGER, 2)))
                .players(List.of(
                        new PlayerSnapshot(1, "A", PlayerRole.WEREWOLF, true, List.of(
                                new StatusRecord(0, GamePhase.SETUP, PlayerStatus.ALIVE, StatusRecord.Reason.REGISTERED))),
                        new PlayerSnapshot(2, "B", PlayerRole.VILLAGER, false, List.of(
                                new StatusRecord(0, GamePhase.SETUP, PlayerStatus.ALIVE, StatusRecord.Reason.REGISTERED),
                                new StatusRecord(2, GamePhase.NIGHT, PlayerStatus.DEAD, StatusRecord.Reason.KILLED)))))
                .takenAt(Instant.parse("2026-10-19T12:00:00Z"))
                .build();
    }

    @Test
    void save_writesJsonWithTtl_andLoadReadsItBack() {
        GameSnapshot snapshot = sample();

        repository.save(snapshot);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(ops).set(eq("test:snapshot"), json.capture(), eq(Duration.ofMinutes(30)));
        assertThat(json.getValue()).contains("\"phase\":\"NIGHT\"").contains("\"name\":\"B\"");

        when(ops.get("test:snapshot")).thenReturn(json.getValue());
        Optional<GameSnapshot> loaded = repository.load();

        assertThat(loaded).contains(snapshot);
    }

    @Test
    void load_returnsEmpty_whenKeyMissing() {
        when(ops.get("test:snapshot")).thenReturn(null);

        assertThat(repository.load()).isEmpty();
    }

    @Test
    void load_failsLoudly_onCorruptJson() {
        when(ops.get("test:snapshot")).thenReturn("{not json");

        assertThatThrownBy(() -> repository.load())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("test:snapshot");
    }

    @Test
    void delete_removesKey() {
        repository.delete();

        verify(template).delete("test:snapshot");
    }
}
