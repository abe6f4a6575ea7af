package com.nhnacademy.booknotionsync.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * 알라딘 응답 형식(JSON/XML)과 무관한 도서 정보.
 * null 로 들어온 값은 빈 문자열로 바꾸고, 제목이 비어 있으면 "제목 없음"을 넣는다.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BookRecord(
        String title,
        String author,
        String publisher,
        String pubDate,
        String isbn10,
        String isbn13,
        String coverImageUrl,
        String detailLink,
        String description,
        RecordSource source
) {
    public static final String UNTITLED = "제목 없음";

    public BookRecord {
        title = (title == null || title.isBlank()) ? UNTITLED : title;
        author = nullToEmpty(author);
        publisher = nullToEmpty(publisher);
        pubDate = nullToEmpty(pubDate);
        isbn10 = nullToEmpty(isbn10);
        isbn13 = nullToEmpty(isbn13);
        coverImageUrl = nullToEmpty(coverImageUrl);
        detailLink = nullToEmpty(detailLink);
        description = nullToEmpty(description);
        source = (source == null) ? RecordSource.SEARCH : source;
    }

    // ISBN13 우선, 없으면 ISBN10
    @JsonIgnore
    public String preferredIsbn() {
        return isbn13.isEmpty() ? isbn10 : isbn13;
    }

    @JsonIgnore
    public boolean hasIsbn() {
        return !preferredIsbn().isEmpty();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
