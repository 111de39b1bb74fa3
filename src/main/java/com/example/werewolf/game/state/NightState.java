package com.example.werewolf.game.state;

import com.example.werewolf.game.domain.GamePhase;

/**
 * 밤 페이즈 상태
 */
public class NightState implements GamePhaseState {

    private final int durationSeconds;

    public NightState(int durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.NIGHT;
    }

    /**
     * 밤이 끝나면 다음 날 토론으로. 라운드 증가는 GameState 가 advancesRound() 를 보고 처리한다.
     */
    @Override
    public GamePhase nextPhase() {
        return GamePhase.DAY_DISCUSSION;
    }

    @Override
    public boolean advancesRound() {
        return true;
    }

    @Override
    public int getDurationSeconds() {
        return durationSeconds;
    }
}
