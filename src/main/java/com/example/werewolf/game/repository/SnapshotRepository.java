package com.example.werewolf.game.repository;

import com.example.werewolf.game.domain.snapshot.GameSnapshot;

import java.util.Optional;

/**
 * 스냅샷 저장소. 저장 매체와 무관하게 마지막으로 저장한 스냅샷 하나만 다룬다.
 */
public interface SnapshotRepository {

    void save(GameSnapshot snapshot);

    Optional<GameSnapshot> load();

    void delete();
}
