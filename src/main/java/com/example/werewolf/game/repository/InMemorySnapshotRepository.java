package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.snapshot.GameSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Repository
@ConditionalOnProperty(prefix = "werewolf.persistence", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySnapshotRepository implements SnapshotRepository {

    private final AtomicReference<GameSnapshot> stored = new AtomicReference<>();

    @Override
    public void save(GameSnapshot snapshot) {
        stored.set(Objects.requireNonNull(snapshot, "snapshot"));
        log.debug("Snapshot stored in memory: phase={}, round={}", snapshot.phase(), snapshot.round());
    }

    @Override
    public Optional<GameSnapshot> load() {
        return Optional.ofNullable(stored.get());
    }

    @Override
    public void delete() {
        stored.set(null);
    }
}
