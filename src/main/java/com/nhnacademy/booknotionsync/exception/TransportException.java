package com.nhnacademy.booknotionsync.exception;

import lombok.Getter;

/**
 * 네트워크 오류, 타임아웃, 2xx가 아닌 응답.
 * 호출한 쪽에서 작업 전체를 다시 시도할 수 있다.
 */
@Getter
public class TransportException extends BookSyncException {

    private final String target; // aladin-search, notion-create 등
    private final Integer statusCode; // HTTP 응답을 받지 못했으면 null

    public TransportException(String target, Integer statusCode, String message, Throwable cause) {
        super(ErrorCode.TRANSPORT, String.format("[%s] %s", target, message), cause);
        this.target = target;
        this.statusCode = statusCode;
    }

    public TransportException(String target, Integer statusCode, String message) {
        this(target, statusCode, message, null);
    }
}
