package com.example.werewolf.global.config;

import com.example.werewolf.game.state.GamePhaseFactory;
import com.example.werewolf.global.event.EventBus;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class GameConfig {

    /**
     * 세션(게임 진행자) 하나당 버스 하나. 전역 static 이 아니라 빈으로 주입한다.
     */
    @Bean
    public EventBus eventBus(GameProperties properties) {
        return new EventBus(properties.getEventHistorySize());
    }

    @Bean
    public GamePhaseFactory gamePhaseFactory(GameProperties properties) {
        GameProperties.Phase phase = properties.getPhase();
        return new GamePhaseFactory(properties.getFirstPhase(),
                phase.getDiscussionSeconds(), phase.getVoteSeconds(), phase.getNightSeconds());
    }

    @Bean
    public Random roleRandom() {
        return new SecureRandom();
    }
}
