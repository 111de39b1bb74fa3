package com.example.werewolf.game.domain;

import lombok.Getter;

@Getter
public enum PlayerRole {
    VILLAGER("Villager"),
    WEREWOLF("Werewolf"),
    GUARD("Guard"),     // 밤에 한 명을 습격에서 지킨다
    SEER("Seer"),       // 밤에 한 명이 인랑인지 확인한다
    MEDIUM("Medium"),   // 처형된 사람이 인랑이었는지 안다
    MADMAN("Madman");   // 인랑 진영의 인간

    private final String displayName;

    PlayerRole(String displayName) {
        this.displayName = displayName;
    }

    public Team getTeam() {
        return Team.of(this);
    }
}
