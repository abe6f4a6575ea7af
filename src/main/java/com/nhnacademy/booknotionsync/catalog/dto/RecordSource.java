package com.nhnacademy.booknotionsync.catalog.dto;

public enum RecordSource {
    // 키워드 검색 결과 (일부 필드 누락 가능)
    SEARCH,
    // ISBN 상세 조회 결과 (같은 ISBN의 검색 결과보다 우선)
    LOOKUP
}
