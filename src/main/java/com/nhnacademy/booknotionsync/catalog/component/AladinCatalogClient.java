package com.nhnacademy.booknotionsync.catalog.component;

import com.nhnacademy.booknotionsync.catalog.dto.BookRecord;
import com.nhnacademy.booknotionsync.catalog.dto.RecordSource;
import com.nhnacademy.booknotionsync.exception.BookNotFoundException;
import com.nhnacademy.booknotionsync.exception.BookSyncException;
import com.nhnacademy.booknotionsync.exception.ConfigException;
import com.nhnacademy.booknotionsync.exception.TransportException;
import com.nhnacademy.booknotionsync.util.BookSyncUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 알라딘 Open API 클라이언트.
 * JSON 으로 먼저 요청하고, 응답이 형식 금지이거나 JSON 이 아니면 같은 요청을 XML 로 딱 한 번 다시 보낸다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AladinCatalogClient {

    static final int MAX_RESULTS_LIMIT = 100;

    private static final String OUTPUT_JSON = "js";
    private static final String OUTPUT_XML = "xml";

    private final WebClient webClient;
    private final ResponseDecoder decoder;

    @Value("${app.aladin.search-url}")
    private String searchUrl;

    @Value("${app.aladin.lookup-url}")
    private String lookupUrl;

    @Value("${app.aladin.api-version:20131101}")
    private String apiVersion;

    @Value("${app.http.timeout-seconds:10}")
    private long timeoutSeconds;

    // 키워드 검색
    public List<BookRecord> search(String keyword, String apiKey, int maxResults) {
        requireApiKey(apiKey);
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("검색어를 입력해주세요.");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("ttbkey", apiKey);
        params.put("Query", keyword.trim());
        params.put("QueryType", "Keyword");
        params.put("MaxResults", Math.max(1, Math.min(maxResults, MAX_RESULTS_LIMIT)));
        params.put("start", 1);
        params.put("SearchTarget", "Book");

        List<Map<String, String>> records = fetchRecords("aladin-search", searchUrl, params);
        log.info("[AladinCatalogClient] 검색 완료. keyword='{}', count={}", keyword, records.size());

        return records.stream()
                .map(r -> toBookRecord(r, RecordSource.SEARCH))
                .toList();
    }

    // ISBN 상세 조회 (여러 건이면 첫 번째만 사용)
    public BookRecord lookup(String isbn, String apiKey) {
        requireApiKey(apiKey);
        String cleaned = BookSyncUtils.cleanIsbn(isbn);
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("올바른 ISBN 번호를 입력해주세요.");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("ttbkey", apiKey);
        params.put("itemIdType", "ISBN");
        params.put("ItemId", cleaned);

        List<Map<String, String>> records = fetchRecords("aladin-lookup", lookupUrl, params);
        if (records.isEmpty()) {
            throw new BookNotFoundException(cleaned);
        }
        if (records.size() > 1) {
            log.debug("[AladinCatalogClient] ISBN 조회 결과 {}건 -> 첫 번째만 사용. isbn={}", records.size(), cleaned);
        }
        return toBookRecord(records.get(0), RecordSource.LOOKUP);
    }

    /**
     * 요청 -> JSON 해석 -> (필요 시) XML 재요청 -> XML 해석.
     * XML 재시도는 한 번뿐이고 그 결과의 실패는 그대로 올린다.
     */
    private List<Map<String, String>> fetchRecords(String target, String url, Map<String, Object> params) {
        String body = get(target, buildUri(url, params, OUTPUT_JSON));
        DecodeResult result = decoder.decode(body);
        if (!result.needsXmlRetry()) {
            return result.records();
        }

        log.info("[AladinCatalogClient] {} JSON 응답 사용 불가 -> XML 형식으로 재시도", target);
        String xmlBody = get(target, buildUri(url, params, OUTPUT_XML));
        return decoder.decodeXml(xmlBody);
    }

    // 값은 URI 변수로 넣어야 '+' 같은 예약 문자까지 인코딩된다 (C++ -> C%2B%2B)
    private URI buildUri(String url, Map<String, Object> params, String output) {
        Map<String, Object> variables = new LinkedHashMap<>(params);
        variables.put("output", output);
        variables.put("Version", apiVersion);
        variables.put("Cover", "Big");

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        variables.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
        return builder
                .encode()
                .buildAndExpand(variables)
                .toUri();
    }

    private String get(String target, URI uri) {
        long start = System.currentTimeMillis();
        try {
            String body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError,
                            resp -> resp.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(errorBody -> new TransportException(
                                            target,
                                            resp.statusCode().value(),
                                            "HTTP " + resp.statusCode() + " body=" + BookSyncUtils.truncate(errorBody, 500))))
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            log.debug("[AladinCatalogClient] {} 응답 수신 ({}ms)", target, System.currentTimeMillis() - start);
            return body == null ? "" : body;

        } catch (BookSyncException e) {
            log.warn("[AladinCatalogClient] {} 실패 ({}ms): {}", target, System.currentTimeMillis() - start, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.warn("[AladinCatalogClient] {} 통신 실패 ({}ms): {}", target, System.currentTimeMillis() - start, e.toString());
            throw new TransportException(target, null, "알라딘 API 요청 중 오류가 발생했습니다: " + e.getMessage(), e);
        }
    }

    private BookRecord toBookRecord(Map<String, String> item, RecordSource source) {
        return BookRecord.builder()
                .title(item.getOrDefault("title", ""))
                .author(item.getOrDefault("author", ""))
                .publisher(item.getOrDefault("publisher", ""))
                .pubDate(item.getOrDefault("pubDate", ""))
                .coverImageUrl(item.getOrDefault("cover", ""))
                .isbn10(item.getOrDefault("isbn", ""))
                .isbn13(item.getOrDefault("isbn13", ""))
                .detailLink(item.getOrDefault("link", ""))
                .description(item.getOrDefault("description", ""))
                .source(source)
                .build();
    }

    private void requireApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigException("알라딘 API 키가 설정되지 않았습니다.");
        }
    }
}
