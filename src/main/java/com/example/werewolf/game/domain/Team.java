package com.example.werewolf.game.domain;

public enum Team {
    VILLAGE,
    WEREWOLF;

    /**
     * 역할에서 진영을 결정한다. 역할이 추가되면 여기서 컴파일 에러가 난다.
     */
    public static Team of(PlayerRole role) {
        return switch (role) {
            case WEREWOLF, MADMAN -> WEREWOLF;
            case VILLAGER, GUARD, SEER, MEDIUM -> VILLAGE;
        };
    }
}
