package com.example.werewolf.global.error;

/**
 * 존재하지 않는 플레이어 또는 스냅샷 참조
 */
public class NotFoundException extends CommonException {

    public NotFoundException(ErrorCode errorCode) {
        super(errorCode);
    }

    public NotFoundException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
