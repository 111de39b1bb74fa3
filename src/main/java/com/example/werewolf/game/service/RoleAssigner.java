package com.example.werewolf.game.service;

import com.example.werewolf.game.domain.PlayerRole;
import com.example.werewolf.game.domain.Regulation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 레귤레이션에서 역할 토큰 목록을 만들고 무작위로 섞는다.
 * Collections.shuffle 은 Fisher-Yates 이므로 멀티셋의 모든 순열이 같은 확률로 나온다.
 */
@Component
public class RoleAssigner {

    private final Random random;

    public RoleAssigner(Random random) {
        this.random = random;
    }

    /**
     * 역할 토큰 멀티셋. 예) WEREWOLF:1, SEER:1, VILLAGER:3 -> [VILLAGER x3, WEREWOLF, SEER]
     */
    public List<PlayerRole> buildRoleTokens(Regulation regulation) {
        List<PlayerRole> roles = new ArrayList<>();
        for (PlayerRole role : PlayerRole.values()) {
            int count = regulation.countOf(role);
            for (int i = 0; i < count; i++) {
                roles.add(role);
            }
        }
        return roles;
    }

    /**
     * 좌석 순서대로 배정할 역할 목록
     */
    public List<PlayerRole> shuffledRoles(Regulation regulation) {
        List<PlayerRole> roles = buildRoleTokens(regulation);
        Collections.shuffle(roles, random);
        return roles;
    }
}
