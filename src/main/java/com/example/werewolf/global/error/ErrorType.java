package com.example.werewolf.global.error;

/**
 * 에러 분류. 어떤 예외 타입으로 던질지 결정한다.
 */
public enum ErrorType {
    CONFIGURATION,
    INVALID_STATE,
    INVALID_TRANSITION,
    NOT_FOUND
}
