package com.nhnacademy.booknotionsync.exception;

import lombok.Getter;

/**
 * 페이지는 생성됐지만 본문(설명) 추가에 실패한 경우.
 * 던지지 않고 SyncResult 의 경고로만 전달한다.
 */
@Getter
public class PartialWriteException extends BookSyncException {

    private final String recordId;

    public PartialWriteException(String recordId, Throwable cause) {
        super(ErrorCode.PARTIAL_WRITE, "페이지는 생성됐지만 본문 추가에 실패했습니다. pageId=" + recordId, cause);
        this.recordId = recordId;
    }
}
