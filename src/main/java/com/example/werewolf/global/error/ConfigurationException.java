package com.example.werewolf.global.error;

/**
 * 레귤레이션과 참가자 구성이 맞지 않을 때
 */
public class ConfigurationException extends CommonException {

    public ConfigurationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ConfigurationException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
