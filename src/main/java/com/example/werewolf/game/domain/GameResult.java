package com.example.werewolf.game.domain;

/**
 * 게임 종료 결과. 같은 처리에서 양 진영이 모두 전멸하면 DRAW.
 */
public enum GameResult {
    VILLAGE,
    WEREWOLF,
    DRAW;

    public static GameResult winnerOf(Team team) {
        return switch (team) {
            case VILLAGE -> VILLAGE;
            case WEREWOLF -> WEREWOLF;
        };
    }
}
