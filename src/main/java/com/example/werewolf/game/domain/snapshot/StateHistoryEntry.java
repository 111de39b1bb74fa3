package com.example.werewolf.game.domain.snapshot;

import java.util.Objects;

public record StateHistoryEntry(SnapshotReason reason, GameSnapshot snapshot) {

    public StateHistoryEntry {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(snapshot, "snapshot");
    }
}
