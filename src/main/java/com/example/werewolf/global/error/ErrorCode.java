package com.example.werewolf.global.error;

import lombok.Getter;

@Getter
public enum ErrorCode {
    // 설정(레귤레이션) 오류
    REGULATION_NOT_SET(ErrorType.CONFIGURATION, "REGULATION_NOT_SET", "Regulation is not set"),
    NEGATIVE_ROLE_COUNT(ErrorType.CONFIGURATION, "NEGATIVE_ROLE_COUNT", "Role count must not be negative"),
    PLAYER_COUNT_MISMATCH(ErrorType.CONFIGURATION, "PLAYER_COUNT_MISMATCH", "Player count does not match regulation"),
    PLAYER_COUNT_OUT_OF_BOUNDS(ErrorType.CONFIGURATION, "PLAYER_COUNT_OUT_OF_BOUNDS", "Player count is out of bounds"),
    INVALID_FIRST_PHASE(ErrorType.CONFIGURATION, "INVALID_FIRST_PHASE", "First phase must be DAY_DISCUSSION or NIGHT"),
    INVALID_PRESET_NAME(ErrorType.CONFIGURATION, "INVALID_PRESET_NAME", "Regulation preset name must not be blank"),

    // 상태 오류
    GAME_ALREADY_ACTIVE(ErrorType.INVALID_STATE, "GAME_ALREADY_ACTIVE", "Game is already active"),
    GAME_NOT_STARTED(ErrorType.INVALID_STATE, "GAME_NOT_STARTED", "Game has not started"),
    GAME_NOT_ACTIVE(ErrorType.INVALID_STATE, "GAME_NOT_ACTIVE", "Game is not active"),
    GAME_FINISHED(ErrorType.INVALID_STATE, "GAME_FINISHED", "Game has finished, reset before starting again"),
    ROSTER_LOCKED(ErrorType.INVALID_STATE, "ROSTER_LOCKED", "Players and regulation can only change during setup"),
    ROLE_ALREADY_ASSIGNED(ErrorType.INVALID_STATE, "ROLE_ALREADY_ASSIGNED", "Role is already assigned"),
    PLAYER_DEAD(ErrorType.INVALID_STATE, "PLAYER_DEAD", "Player is dead"),
    DUPLICATE_PLAYER_NAME(ErrorType.INVALID_STATE, "DUPLICATE_PLAYER_NAME", "Player name already exists"),
    DUPLICATE_PLAYER_NUMBER(ErrorType.INVALID_STATE, "DUPLICATE_PLAYER_NUMBER", "Player number already exists"),
    INVALID_SNAPSHOT(ErrorType.INVALID_STATE, "INVALID_SNAPSHOT", "Snapshot is not restorable"),
    NO_PLAYERS(ErrorType.INVALID_STATE, "NO_PLAYERS", "No players registered"),
    REGULATION_NOT_CONFIRMED(ErrorType.INVALID_STATE, "REGULATION_NOT_CONFIRMED", "Regulation is not confirmed"),
    PLAYERS_NOT_CONFIRMED(ErrorType.INVALID_STATE, "PLAYERS_NOT_CONFIRMED", "Players are not confirmed"),

    // 페이즈 전환 오류
    INVALID_PHASE_TRANSITION(ErrorType.INVALID_TRANSITION, "INVALID_PHASE_TRANSITION", "Illegal phase transition"),

    // 조회 오류
    PLAYER_NOT_FOUND(ErrorType.NOT_FOUND, "PLAYER_NOT_FOUND", "Player not found"),
    SNAPSHOT_NOT_FOUND(ErrorType.NOT_FOUND, "SNAPSHOT_NOT_FOUND", "No saved snapshot"),
    PRESET_NOT_FOUND(ErrorType.NOT_FOUND, "PRESET_NOT_FOUND", "Regulation preset not found"),
    ;
    private final ErrorType type;
    private final String code;
    private final String message;

    ErrorCode(ErrorType type, String code, String message) {
        this.type = type;
        this.code = code;
        this.message = message;
    }

    public CommonException exception() {
        return exception(null);
    }

    /**
     * 에러 분류에 맞는 예외를 생성한다.
     *
     * @param detail 메시지 뒤에 붙일 상세 정보 (null 가능)
     */
    public CommonException exception(String detail) {
        return switch (type) {
            case CONFIGURATION -> new ConfigurationException(this, detail);
            case INVALID_STATE -> new InvalidStateException(this, detail);
            case INVALID_TRANSITION -> new InvalidTransitionException(this, detail);
            case NOT_FOUND -> new NotFoundException(this, detail);
        };
    }
}
