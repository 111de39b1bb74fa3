package com.example.werewolf.game.domain;

public enum GamePhase {
    SETUP, // 게임 시작 전 준비
    DAY_DISCUSSION, // 낮 토론
    DAY_VOTE, // 낮 투표
    NIGHT // 밤
}
