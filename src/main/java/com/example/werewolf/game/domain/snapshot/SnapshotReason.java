package com.example.werewolf.game.domain.snapshot;

/**
 * 상태 이력에 스냅샷이 남은 계기
 */
public enum SnapshotReason {
    PLAYER_ADDED,
    PLAYER_REMOVED,
    REGULATION_SET,
    REGULATION_CONFIRMED,
    PLAYERS_CONFIRMED,
    GAME_STARTED,
    PHASE_CHANGED,
    PLAYER_DIED,
    GAME_ENDED,
    GAME_RESET,
    RESTORED
}
