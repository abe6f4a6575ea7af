package com.nhnacademy.booknotionsync.notion.component;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Notion 오류 응답을 보고 사용자가 확인할 부분을 알려준다.
 */
@Getter
@RequiredArgsConstructor
public enum NotionErrorHint {
    DATABASE("Notion 데이터베이스 ID가 올바른지, Integration이 데이터베이스에 연결되어 있는지 확인하세요."),
    SCHEMA("Notion 데이터베이스에 제목, 저자, 출판사, 출판일, ISBN, 표지 속성이 정확한 이름으로 있는지 확인하세요."),
    CREDENTIAL("Notion API 키가 올바른지 확인하세요."),
    NONE("");

    private final String message;

    public static NotionErrorHint classify(String errorBody) {
        if (errorBody == null) return NONE;
        String lower = errorBody.toLowerCase(Locale.ROOT);

        if (lower.contains("object_not_found") || lower.contains("database")) return DATABASE;
        if (lower.contains("property") || lower.contains("schema")) return SCHEMA;
        if (lower.contains("unauthorized") || lower.contains("invalid")) return CREDENTIAL;
        return NONE;
    }
}
