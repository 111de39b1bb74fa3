package com.example.werewolf.global.config;

import com.example.werewolf.game.domain.GamePhase;
import com.example.werewolf.game.domain.PlayerRole;
import com.example.werewolf.game.domain.Regulation;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * werewolf.* 설정 바인딩
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "werewolf")
public class GameProperties {

    private int minPlayers = Regulation.DEFAULT_MIN_PLAYERS;
    private int maxPlayers = Regulation.DEFAULT_MAX_PLAYERS;

    /** 게임 시작 직후 페이즈 (DAY_DISCUSSION 또는 NIGHT) */
    private GamePhase firstPhase = GamePhase.DAY_DISCUSSION;

    private int eventHistorySize = 1000;

    /** 시작 전에 레귤레이션과 참가자 확정을 요구할지 여부 */
    private boolean requireConfirmation = true;

    /** 게임마다 자동으로 남기는 상태 스냅샷 개수 */
    private int stateHistorySize = 100;

    private Phase phase = new Phase();

    /** 새 게임에 기본으로 적용할 역할 구성 */
    private Map<PlayerRole, Integer> roles = new LinkedHashMap<>();

    private Persistence persistence = new Persistence();

    public Regulation defaultRegulation() {
        return new Regulation(roles, minPlayers, maxPlayers);
    }

    @Getter
    @Setter
    public static class Phase {
        private int discussionSeconds = 180;
        private int voteSeconds = 60;
        private int nightSeconds = 60;
    }

    @Getter
    @Setter
    public static class Persistence {
        /** memory | redis */
        private String type = "memory";
        private String redisKey = "werewolf:snapshot";
        private String presetKey = "werewolf:regulations";
        private Duration ttl = Duration.ofDays(1);
    }
}
