package com.nhnacademy.booknotionsync.exception;

/**
 * API 키, 토큰, 데이터베이스 ID 등 자격 정보가 비어 있을 때 발생한다.
 * 요청을 보내기 전에 던지므로 재시도하지 않는다.
 */
public class ConfigException extends BookSyncException {

    public ConfigException(String message) {
        super(ErrorCode.CONFIG, message);
    }
}
