package com.nhnacademy.booknotionsync.notion.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 한 권의 도서를 Notion 페이지 속성으로 바꾼 결과. 생성 후에는 바뀌지 않는다.
 */
public final class DestinationPayload {

    private final Map<BookProperty, PropertyValue> values;

    private DestinationPayload(Map<BookProperty, PropertyValue> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(BookProperty property) {
        return values.containsKey(property);
    }

    public Optional<PropertyValue> get(BookProperty property) {
        return Optional.ofNullable(values.get(property));
    }

    public Map<BookProperty, PropertyValue> values() {
        return values;
    }

    // Notion pages API 의 properties 필드 (컬럼 이름 -> 값)
    public Map<String, Object> toNotionProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        values.forEach((property, value) -> properties.put(property.getColumnName(), value.toNotionValue()));
        return properties;
    }

    @Override
    public String toString() {
        return "DestinationPayload" + values.keySet();
    }

    public static final class Builder {
        private final Map<BookProperty, PropertyValue> values = new EnumMap<>(BookProperty.class);

        private Builder() {}

        public Builder put(BookProperty property, PropertyValue value) {
            values.put(property, value);
            return this;
        }

        public DestinationPayload build() {
            if (!values.containsKey(BookProperty.TITLE)) {
                throw new IllegalStateException("TITLE 속성은 반드시 있어야 합니다.");
            }
            return new DestinationPayload(values);
        }
    }
}
