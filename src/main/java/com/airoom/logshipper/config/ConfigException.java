package com.airoom.logshipper.config;

/** 설정 파일을 읽거나 만들 수 없을 때 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
