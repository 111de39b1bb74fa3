package com.example.werewolf.global.error;

/**
 * 현재 상태에서 허용되지 않는 조작
 */
public class InvalidStateException extends CommonException {

    public InvalidStateException(ErrorCode errorCode) {
        super(errorCode);
    }

    public InvalidStateException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
