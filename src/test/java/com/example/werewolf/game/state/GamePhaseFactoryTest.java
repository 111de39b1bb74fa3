package com.example.werewolf.game.state;

import com.example.werewolf.game.domain.GamePhase;
import com.example.werewolf.global.error.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GamePhaseFactoryTest {

    @Test
    @DisplayName("각 페이즈의 다음 페이즈는 하나뿐이다")
    void successors() {
        GamePhaseFactory factory = GamePhaseFactory.defaults();

        assertThat(factory.getState(GamePhase.SETUP).nextPhase()).isEqualTo(GamePhase.DAY_DISCUSSION);
        assertThat(factory.getState(GamePhase.DAY_DISCUSSION).nextPhase()).isEqualTo(GamePhase.DAY_VOTE);
        assertThat(factory.getState(GamePhase.DAY_VOTE).nextPhase()).isEqualTo(GamePhase.NIGHT);
        assertThat(factory.getState(GamePhase.NIGHT).nextPhase()).isEqualTo(GamePhase.DAY_DISCUSSION);

        assertThat(factory.getState(GamePhase.NIGHT).canTransitionTo(GamePhase.DAY_VOTE)).isFalse();
        assertThat(factory.getState(GamePhase.DAY_VOTE).canTransitionTo(GamePhase.SETUP)).isFalse();
    }

    @Test
    @DisplayName("라운드는 밤 -> 낮 토론 전환에서만 증가한다")
    void onlyNightAdvancesRound() {
        GamePhaseFactory factory = GamePhaseFactory.defaults();

        for (GamePhase phase : GamePhase.values()) {
            assertThat(factory.getState(phase).advancesRound()).isEqualTo(phase == GamePhase.NIGHT);
        }
    }

    @Test
    @DisplayName("페이즈 시간 설정이 반영된다")
    void durations() {
        GamePhaseFactory factory = new GamePhaseFactory(GamePhase.DAY_DISCUSSION, 300, 45, 90);

        assertThat(factory.getState(GamePhase.SETUP).getDurationSeconds()).isZero();
        assertThat(factory.getState(GamePhase.DAY_DISCUSSION).getDurationSeconds()).isEqualTo(300);
        assertThat(factory.getState(GamePhase.DAY_VOTE).getDurationSeconds()).isEqualTo(45);
        assertThat(factory.getState(GamePhase.NIGHT).getDurationSeconds()).isEqualTo(90);
    }

    @Test
    @DisplayName("첫 페이즈는 낮 토론 또는 밤만 허용된다")
    void invalidFirstPhase() {
        assertThat(new GamePhaseFactory(GamePhase.NIGHT, 1, 1, 1).getFirstPhase()).isEqualTo(GamePhase.NIGHT);
        assertThatThrownBy(() -> new GamePhaseFactory(GamePhase.DAY_VOTE, 1, 1, 1))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new GamePhaseFactory(GamePhase.SETUP, 1, 1, 1))
                .isInstanceOf(ConfigurationException.class);
    }
}
