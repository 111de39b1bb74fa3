package com.example.werewolf.game.state;

import com.example.werewolf.game.domain.GamePhase;

/**
 * 게임 페이즈 상태 인터페이스 (State Pattern)
 */
public interface GamePhaseState {

    /**
     * 현재 페이즈 종류 반환
     */
    GamePhase getGamePhase();

    /**
     * 이 페이즈 다음에 올 수 있는 유일한 페이즈
     */
    GamePhase nextPhase();

    /**
     * 다음 페이즈로 넘어갈 때 라운드가 하나 증가하는지 여부
     */
    default boolean advancesRound() {
        return false;
    }

    /**
     * 페이즈 지속 시간 (초). 타이머가 없는 페이즈는 0
     */
    int getDurationSeconds();

    default boolean canTransitionTo(GamePhase phase) {
        return nextPhase() == phase;
    }
}
