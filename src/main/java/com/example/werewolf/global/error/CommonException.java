package com.example.werewolf.global.error;

import lombok.Getter;

@Getter
public class CommonException extends RuntimeException {

    private final ErrorCode errorCode;

    public CommonException(ErrorCode errorCode) {
        this(errorCode, null);
    }

    public CommonException(ErrorCode errorCode, String detail) {
        super(detail == null ? errorCode.getMessage() : errorCode.getMessage() + ": " + detail);
        this.errorCode = errorCode;
    }
}
