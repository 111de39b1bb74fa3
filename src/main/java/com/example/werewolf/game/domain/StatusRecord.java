package com.example.werewolf.game.domain;

/**
 * 플레이어 상태 변경 이력 한 건.
 */
public record StatusRecord(int round, GamePhase phase, PlayerStatus status, Reason reason) {

    public enum Reason {
        REGISTERED,
        KILLED,
        RESURRECTED
    }
}
