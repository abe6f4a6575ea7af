package com.nhnacademy.booknotionsync.notion.dto;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Notion 속성 값. toNotionValue() 는 pages API 의 properties 항목 JSON 구조를 그대로 만든다.
 */
public interface PropertyValue {

    Map<String, Object> toNotionValue();

    private static List<Map<String, Object>> textSegments(String content) {
        return List.of(Map.of("text", Map.of("content", content)));
    }

    record TitleValue(String text) implements PropertyValue {
        @Override
        public Map<String, Object> toNotionValue() {
            return Map.of("title", textSegments(text));
        }
    }

    record RichTextValue(String text) implements PropertyValue {
        @Override
        public Map<String, Object> toNotionValue() {
            return Map.of("rich_text", textSegments(text));
        }
    }

    record DateValue(LocalDate date) implements PropertyValue {
        @Override
        public Map<String, Object> toNotionValue() {
            return Map.of("date", Map.of("start", date.format(DateTimeFormatter.ISO_LOCAL_DATE)));
        }
    }

    // 외부 URL 을 가리키는 파일 (표지 이미지)
    record ExternalFileValue(String name, String url) implements PropertyValue {
        @Override
        public Map<String, Object> toNotionValue() {
            return Map.of("files", List.of(Map.of(
                    "type", "external",
                    "name", name,
                    "external", Map.of("url", url)
            )));
        }
    }
}
