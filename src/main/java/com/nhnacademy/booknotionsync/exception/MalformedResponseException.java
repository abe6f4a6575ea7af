package com.nhnacademy.booknotionsync.exception;

public class MalformedResponseException extends BookSyncException {

    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_RESPONSE, message, cause);
    }
}
