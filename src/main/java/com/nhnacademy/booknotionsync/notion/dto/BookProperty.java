package com.nhnacademy.booknotionsync.notion.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Notion 데이터베이스의 도서 속성.
 * columnName 은 사용자가 만든 데이터베이스의 컬럼 이름과 정확히 일치해야 한다.
 */
@Getter
@RequiredArgsConstructor
public enum BookProperty {
    TITLE("제목"),
    AUTHOR("저자"),
    PUBLISHER("출판사"),
    PUBLISHED_DATE("출판일"),
    ISBN("ISBN"),
    COVER_IMAGE("표지");

    private final String columnName;
}
