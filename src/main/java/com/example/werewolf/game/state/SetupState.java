package com.example.werewolf.game.state;

import com.example.werewolf.game.domain.GamePhase;

/**
 * 준비 페이즈. startGame 으로만 빠져나가며 다시 들어오지 않는다.
 */
public class SetupState implements GamePhaseState {

    private final GamePhase firstPhase;

    public SetupState(GamePhase firstPhase) {
        this.firstPhase = firstPhase;
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.SETUP;
    }

    @Override
    public GamePhase nextPhase() {
        return firstPhase;
    }

    @Override
    public int getDurationSeconds() {
        return 0;
    }
}
