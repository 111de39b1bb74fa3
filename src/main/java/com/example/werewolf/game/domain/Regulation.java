package com.example.werewolf.game.domain;

import com.example.werewolf.global.error.ErrorCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 레귤레이션: 역할별 필요 인원과 참가 인원 범위.
 * 검증은 게임 시작 시점에만 한다. 음수 인원도 일단 담아 두고 startGame 에서 거부한다.
 */
public record Regulation(Map<PlayerRole, Integer> roles, int minPlayers, int maxPlayers) {

    public static final int DEFAULT_MIN_PLAYERS = 3;
    public static final int DEFAULT_MAX_PLAYERS = 20;

    public Regulation {
        Objects.requireNonNull(roles, "roles");
        Map<PlayerRole, Integer> copy = new EnumMap<>(PlayerRole.class);
        roles.forEach((role, count) -> copy.put(Objects.requireNonNull(role, "role"),
                Objects.requireNonNull(count, "count of " + role)));
        roles = Collections.unmodifiableMap(copy);
    }

    public static Regulation of(Map<PlayerRole, Integer> roles) {
        return new Regulation(roles, DEFAULT_MIN_PLAYERS, DEFAULT_MAX_PLAYERS);
    }

    /**
     * 특수 역할만 지정하고 나머지는 VILLAGER 로 채운다.
     */
    public static Regulation withVillagerRemainder(Map<PlayerRole, Integer> specialRoles, int playerCount,
                                                   int minPlayers, int maxPlayers) {
        Map<PlayerRole, Integer> roles = new EnumMap<>(PlayerRole.class);
        roles.putAll(specialRoles);
        int villagers = roles.getOrDefault(PlayerRole.VILLAGER, 0);
        int specials = roles.entrySet().stream()
                .filter(e -> e.getKey() != PlayerRole.VILLAGER)
                .mapToInt(Map.Entry::getValue)
                .sum();
        roles.put(PlayerRole.VILLAGER, Math.max(villagers, playerCount - specials));
        return new Regulation(roles, minPlayers, maxPlayers);
    }

    public int countOf(PlayerRole role) {
        return roles.getOrDefault(role, 0);
    }

    public int totalPlayers() {
        return roles.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * 참가 인원과 무관한 검사. 프리셋 저장 시에도 쓴다.
     */
    public void validateRoleCounts() {
        for (Map.Entry<PlayerRole, Integer> entry : roles.entrySet()) {
            if (entry.getValue() < 0) {
                throw ErrorCode.NEGATIVE_ROLE_COUNT.exception(entry.getKey() + "=" + entry.getValue());
            }
        }
        if (minPlayers > maxPlayers) {
            throw ErrorCode.PLAYER_COUNT_OUT_OF_BOUNDS.exception(
                    "minPlayers " + minPlayers + " > maxPlayers " + maxPlayers);
        }
    }

    /**
     * @throws com.example.werewolf.global.error.ConfigurationException 인원 구성이 맞지 않으면
     */
    public void validate(int playerCount) {
        validateRoleCounts();
        if (playerCount < minPlayers || playerCount > maxPlayers) {
            throw ErrorCode.PLAYER_COUNT_OUT_OF_BOUNDS.exception(
                    playerCount + " not in [" + minPlayers + ", " + maxPlayers + "]");
        }
        int required = totalPlayers();
        if (required != playerCount) {
            throw ErrorCode.PLAYER_COUNT_MISMATCH.exception("players=" + playerCount + ", regulation=" + required);
        }
    }
}
