package com.nhnacademy.booknotionsync.catalog.component;

import java.util.List;
import java.util.Map;

/**
 * ResponseDecoder 의 JSON 해석 결과.
 * RECORDS 면 records 를 그대로 쓰고, RETRY_AS_XML 이면 같은 요청을 output=xml 로 한 번 더 보낸다.
 */
public record DecodeResult(Outcome outcome, List<Map<String, String>> records) {

    public enum Outcome {
        RECORDS,
        RETRY_AS_XML
    }

    public static DecodeResult records(List<Map<String, String>> records) {
        return new DecodeResult(Outcome.RECORDS, List.copyOf(records));
    }

    public static DecodeResult retryAsXml() {
        return new DecodeResult(Outcome.RETRY_AS_XML, List.of());
    }

    public boolean needsXmlRetry() {
        return outcome == Outcome.RETRY_AS_XML;
    }
}
