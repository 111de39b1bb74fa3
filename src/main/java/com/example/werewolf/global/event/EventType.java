package com.example.werewolf.global.event;

public enum EventType {
    // 플레이어
    PLAYER_ADDED,
    PLAYER_REMOVED,
    PLAYER_ROLE_ASSIGNED,
    PLAYER_DIED,

    // 설정
    REGULATION_UPDATED,
    REGULATION_CONFIRMED,
    PLAYERS_CONFIRMED,
    REGULATION_SAVED,

    // 게임 진행
    GAME_STARTED,
    PHASE_CHANGED,
    ROUND_CHANGED,
    GAME_ENDED,
    GAME_STATE_RESET,
    GAME_STATE_RESTORED,

    // 리스너 실패
    ERROR
}
