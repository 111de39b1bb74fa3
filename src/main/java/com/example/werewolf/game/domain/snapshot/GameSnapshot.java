package com.example.werewolf.game.domain.snapshot;

import com.example.werewolf.game.domain.GamePhase;
import com.example.werewolf.game.domain.GameResult;
import com.example.werewolf.game.domain.Regulation;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * 특정 시점의 게임 상태 사본. 라이브 GameState 와 아무것도 공유하지 않는다.
 *
 * @param regulation null 가능 (설정 전)
 * @param result     게임이 끝나지 않았으면 null
 */
@Builder
public record GameSnapshot(
        GamePhase phase,
        int round,
        boolean gameActive,
        GameResult result,
        Regulation regulation,
        boolean regulationConfirmed,
        boolean playersConfirmed,
        List<PlayerSnapshot> players,
        Instant takenAt) {

    public GameSnapshot {
        players = players == null ? List.of() : List.copyOf(players);
        takenAt = takenAt == null ? Instant.now() : takenAt;
    }
}
