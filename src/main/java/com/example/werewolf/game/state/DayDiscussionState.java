package com.example.werewolf.game.state;

import com.example.werewolf.game.domain.GamePhase;

/**
 * 낮 토론 페이즈 상태
 */
public class DayDiscussionState implements GamePhaseState {

    private final int durationSeconds;

    public DayDiscussionState(int durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.DAY_DISCUSSION;
    }

    @Override
    public GamePhase nextPhase() {
        return GamePhase.DAY_VOTE;
    }

    @Override
    public int getDurationSeconds() {
        return durationSeconds;
    }
}
