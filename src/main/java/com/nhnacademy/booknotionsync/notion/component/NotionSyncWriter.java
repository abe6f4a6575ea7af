package com.nhnacademy.booknotionsync.notion.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.nhnacademy.booknotionsync.exception.BookSyncException;
import com.nhnacademy.booknotionsync.exception.ConfigException;
import com.nhnacademy.booknotionsync.exception.MalformedResponseException;
import com.nhnacademy.booknotionsync.exception.PartialWriteException;
import com.nhnacademy.booknotionsync.exception.TransportException;
import com.nhnacademy.booknotionsync.notion.dto.DestinationPayload;
import com.nhnacademy.booknotionsync.notion.dto.SyncResult;
import com.nhnacademy.booknotionsync.util.BookSyncUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Notion 데이터베이스에 도서 페이지를 만든다. 저장은 항상 새 페이지 생성이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotionSyncWriter {

    // Notion rich_text 한 조각의 최대 길이
    static final int MAX_TEXT_LENGTH = 2000;

    private final WebClient webClient;

    @Value("${app.notion.base-url:https://api.notion.com/v1}")
    private String baseUrl;

    @Value("${app.notion.version:2022-06-28}")
    private String notionVersion;

    @Value("${app.http.timeout-seconds:10}")
    private long timeoutSeconds;

    /**
     * 페이지를 생성하고, note 가 있으면 본문 문단으로 붙인다.
     * 본문 추가가 실패해도 페이지는 지우지 않고 경고만 담아 돌려준다.
     */
    public SyncResult create(DestinationPayload payload, String authToken, String containerId, String note) {
        if (authToken == null || authToken.isBlank() || containerId == null || containerId.isBlank()) {
            throw new ConfigException("Notion API 키 또는 데이터베이스 ID가 설정되지 않았습니다.");
        }

        String databaseId = BookSyncUtils.extractDatabaseId(containerId);
        JsonNode page = send("notion-create", HttpMethod.POST, baseUrl + "/pages", authToken,
                buildCreateRequest(payload, databaseId));

        String pageId = page == null ? "" : page.path("id").asText("");
        if (pageId.isEmpty()) {
            throw new MalformedResponseException("Notion 응답에 페이지 id가 없습니다.", null);
        }
        log.info("[NotionSyncWriter] 페이지 생성 완료. pageId={}, properties={}", pageId, payload);

        if (note == null || note.isEmpty()) {
            return SyncResult.complete(pageId);
        }

        try {
            send("notion-append", HttpMethod.PATCH, baseUrl + "/blocks/" + pageId + "/children", authToken,
                    buildAppendRequest(note));
            return SyncResult.complete(pageId);
        } catch (BookSyncException e) {
            log.warn("[NotionSyncWriter] 본문 추가 실패 -> 속성만 저장된 페이지로 유지. pageId={}, cause={}", pageId, e.getMessage());
            return SyncResult.partial(pageId, new PartialWriteException(pageId, e));
        }
    }

    Map<String, Object> buildCreateRequest(DestinationPayload payload, String databaseId) {
        return Map.of(
                "parent", Map.of("database_id", databaseId),
                "properties", payload.toNotionProperties()
        );
    }

    // 문단 블록 하나, 2000자 단위로 나눈 rich_text 조각들 (서로게이트 쌍은 자르지 않음)
    Map<String, Object> buildAppendRequest(String note) {
        List<Map<String, Object>> segments = new ArrayList<>();
        int start = 0;
        while (start < note.length()) {
            int end = Math.min(note.length(), start + MAX_TEXT_LENGTH);
            if (end < note.length() && Character.isHighSurrogate(note.charAt(end - 1))) {
                end--;
            }
            segments.add(Map.of("type", "text", "text", Map.of("content", note.substring(start, end))));
            start = end;
        }

        Map<String, Object> paragraph = Map.of(
                "object", "block",
                "type", "paragraph",
                "paragraph", Map.of("rich_text", segments)
        );
        return Map.of("children", List.of(paragraph));
    }

    private JsonNode send(String target, HttpMethod method, String url, String authToken, Map<String, Object> body) {
        long start = System.currentTimeMillis();
        try {
            JsonNode response = webClient.method(method)
                    .uri(url)
                    .headers(h -> {
                        h.setBearerAuth(authToken);
                        h.set("Notion-Version", notionVersion);
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError,
                            resp -> resp.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(errorBody -> toTransportException(target, resp.statusCode(), errorBody)))
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            log.debug("[NotionSyncWriter] {} 성공 ({}ms)", target, System.currentTimeMillis() - start);
            return response;

        } catch (BookSyncException e) {
            throw e;
        } catch (Exception e) {
            log.warn("[NotionSyncWriter] {} 통신 실패 ({}ms): {}", target, System.currentTimeMillis() - start, e.toString());
            throw new TransportException(target, null, "Notion 요청 중 오류가 발생했습니다: " + e.getMessage(), e);
        }
    }

    private TransportException toTransportException(String target, HttpStatusCode status, String errorBody) {
        NotionErrorHint hint = NotionErrorHint.classify(errorBody);
        log.warn("[NotionSyncWriter] {} 실패 status={} body={}", target, status, BookSyncUtils.truncate(errorBody, 800));

        String message = "Notion에 저장하는 중 오류가 발생했습니다. HTTP " + status.value();
        if (hint != NotionErrorHint.NONE) {
            message += " - " + hint.getMessage();
        }
        return new TransportException(target, status.value(), message);
    }
}
