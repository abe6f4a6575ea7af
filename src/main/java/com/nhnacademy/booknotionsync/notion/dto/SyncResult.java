package com.nhnacademy.booknotionsync.notion.dto;

import com.nhnacademy.booknotionsync.exception.PartialWriteException;

/**
 * Notion 페이지 생성 결과. 본문 추가만 실패했다면 warning 에 담긴다.
 */
public record SyncResult(String recordId, PartialWriteException warning) {

    public static SyncResult complete(String recordId) {
        return new SyncResult(recordId, null);
    }

    public static SyncResult partial(String recordId, PartialWriteException warning) {
        return new SyncResult(recordId, warning);
    }

    public boolean isPartial() {
        return warning != null;
    }
}
