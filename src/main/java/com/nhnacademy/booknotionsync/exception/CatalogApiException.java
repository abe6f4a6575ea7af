package com.nhnacademy.booknotionsync.exception;

import lombok.Getter;

/**
 * 알라딘이 errorCode/errorMessage로 응답했지만 XML 재시도 대상이 아닌 경우.
 */
@Getter
public class CatalogApiException extends BookSyncException {

    private final String catalogErrorCode;

    public CatalogApiException(String catalogErrorCode, String catalogMessage) {
        super(ErrorCode.CATALOG_API, "알라딘 API 오류: " + catalogMessage);
        this.catalogErrorCode = catalogErrorCode;
    }
}
