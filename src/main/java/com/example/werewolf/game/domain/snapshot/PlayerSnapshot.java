package com.example.werewolf.game.domain.snapshot;

import com.example.werewolf.game.domain.PlayerRole;
import com.example.werewolf.game.domain.StatusRecord;

import java.util.List;

public record PlayerSnapshot(
        int number,
        String name,
        PlayerRole role,
        boolean alive,
        List<StatusRecord> statusHistory) {

    public PlayerSnapshot {
        statusHistory = statusHistory == null ? List.of() : List.copyOf(statusHistory);
    }
}
