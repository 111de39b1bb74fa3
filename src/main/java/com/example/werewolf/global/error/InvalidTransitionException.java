package com.example.werewolf.global.error;

/**
 * 허용되지 않는 페이즈 전환
 */
public class InvalidTransitionException extends CommonException {

    public InvalidTransitionException(ErrorCode errorCode) {
        super(errorCode);
    }

    public InvalidTransitionException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
