package com.example.werewolf.game.state;

import com.example.werewolf.game.domain.GamePhase;

/**
 * 낮 투표 페이즈 상태
 */
public class DayVoteState implements GamePhaseState {

    private final int durationSeconds;

    public DayVoteState(int durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.DAY_VOTE;
    }

    @Override
    public GamePhase nextPhase() {
        return GamePhase.NIGHT;
    }

    @Override
    public int getDurationSeconds() {
        return durationSeconds;
    }
}
