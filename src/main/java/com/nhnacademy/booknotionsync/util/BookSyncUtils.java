package com.nhnacademy.booknotionsync.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class BookSyncUtils {

    private BookSyncUtils() {}

    private static final Pattern ISBN_NOISE = Pattern.compile("[-\\s]");
    private static final Pattern DASHED_DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})(?:\\s+.*)?$");
    private static final Pattern COMPACT_DATE = Pattern.compile("^\\d{8}$");
    private static final Pattern NOTION_ID = Pattern.compile(
            "([a-f0-9]{32}|[a-f0-9]{8}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{12})");

    private static final DateTimeFormatter DASHED_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter COMPACT_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    // ISBN 정제 (하이픈, 공백 제거)
    public static String cleanIsbn(String isbn) {
        if (isbn == null) return "";
        return ISBN_NOISE.matcher(isbn.trim()).replaceAll("");
    }

    /**
     * 알라딘 출판일 문자열을 날짜로 변환한다.
     * "yyyy-MM-dd", "yyyy-MM-dd HH:mm:ss"(시간은 버림), "yyyyMMdd"만 허용하고
     * 나머지 형식이나 존재하지 않는 날짜는 빈 값으로 돌려준다.
     */
    public static Optional<LocalDate> normalizeDate(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String value = raw.trim();

        try {
            Matcher dashed = DASHED_DATE.matcher(value);
            if (dashed.matches()) {
                return Optional.of(LocalDate.parse(dashed.group(1), DASHED_FORMAT));
            }
            if (COMPACT_DATE.matcher(value).matches()) {
                return Optional.of(LocalDate.parse(value, COMPACT_FORMAT));
            }
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Notion 공유 링크 또는 ID 문자열에서 데이터베이스 ID를 꺼낸다.
     * 링크가 아니거나 ID 모양을 못 찾으면 입력을 그대로 두고 하이픈만 제거한다.
     */
    public static String extractDatabaseId(String idOrUrl) {
        if (idOrUrl == null) return "";
        String id = idOrUrl.trim();

        if (id.contains("notion.site") || id.contains("notion.so")) {
            Matcher matcher = NOTION_ID.matcher(id);
            if (matcher.find()) {
                id = matcher.group(1);
            }
        }
        return id.replace("-", "");
    }

    // 긴 문자열 자르기 (로그용)
    public static String truncate(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max) + "...(truncated)";
    }
}
