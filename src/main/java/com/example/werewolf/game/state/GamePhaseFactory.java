package com.example.werewolf.game.state;

import com.example.werewolf.game.domain.GamePhase;
import com.example.werewolf.global.error.ErrorCode;

/**
 * 페이즈별 상태를 제공하는 Factory
 */
public class GamePhaseFactory {

    public static final int DEFAULT_DISCUSSION_SECONDS = 180;
    public static final int DEFAULT_VOTE_SECONDS = 60;
    public static final int DEFAULT_NIGHT_SECONDS = 60;

    private final SetupState setupState;
    private final DayDiscussionState dayDiscussionState;
    private final DayVoteState dayVoteState;
    private final NightState nightState;

    /**
     * @param firstPhase 게임 시작 직후 페이즈. DAY_DISCUSSION 또는 NIGHT
     * @throws com.example.werewolf.global.error.ConfigurationException 그 외 페이즈가 주어진 경우
     */
    public GamePhaseFactory(GamePhase firstPhase, int discussionSeconds, int voteSeconds, int nightSeconds) {
        if (firstPhase != GamePhase.DAY_DISCUSSION && firstPhase != GamePhase.NIGHT) {
            throw ErrorCode.INVALID_FIRST_PHASE.exception(String.valueOf(firstPhase));
        }
        this.setupState = new SetupState(firstPhase);
        this.dayDiscussionState = new DayDiscussionState(discussionSeconds);
        this.dayVoteState = new DayVoteState(voteSeconds);
        this.nightState = new NightState(nightSeconds);
    }

    public static GamePhaseFactory defaults() {
        return new GamePhaseFactory(GamePhase.DAY_DISCUSSION,
                DEFAULT_DISCUSSION_SECONDS, DEFAULT_VOTE_SECONDS, DEFAULT_NIGHT_SECONDS);
    }

    /**
     * 현재 페이즈에 맞는 상태 객체 반환
     */
    public GamePhaseState getState(GamePhase phase) {
        return switch (phase) {
            case SETUP -> setupState;
            case DAY_DISCUSSION -> dayDiscussionState;
            case DAY_VOTE -> dayVoteState;
            case NIGHT -> nightState;
        };
    }

    public GamePhase getFirstPhase() {
        return setupState.nextPhase();
    }
}
