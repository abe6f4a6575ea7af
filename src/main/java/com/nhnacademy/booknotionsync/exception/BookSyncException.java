package com.nhnacademy.booknotionsync.exception;

public class BookSyncException extends RuntimeException {

    private final ErrorCode errorCode;

    public BookSyncException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BookSyncException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public enum ErrorCode {
        CONFIG,
        TRANSPORT,
        MALFORMED_RESPONSE,
        CATALOG_API,
        NOT_FOUND,
        PARTIAL_WRITE
    }
}
