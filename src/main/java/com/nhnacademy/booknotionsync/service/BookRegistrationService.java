package com.nhnacademy.booknotionsync.service;

import com.nhnacademy.booknotionsync.catalog.component.AladinCatalogClient;
import com.nhnacademy.booknotionsync.catalog.dto.BookRecord;
import com.nhnacademy.booknotionsync.catalog.dto.RecordSource;
import com.nhnacademy.booknotionsync.dto.RegistrationResult;
import com.nhnacademy.booknotionsync.dto.SyncCredentials;
import com.nhnacademy.booknotionsync.exception.BookSyncException;
import com.nhnacademy.booknotionsync.exception.ConfigException;
import com.nhnacademy.booknotionsync.notion.component.NotionSyncWriter;
import com.nhnacademy.booknotionsync.notion.component.RecordMapper;
import com.nhnacademy.booknotionsync.notion.dto.DestinationPayload;
import com.nhnacademy.booknotionsync.notion.dto.SyncResult;
import com.nhnacademy.booknotionsync.util.BookSyncUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookRegistrationService {

    private final AladinCatalogClient catalogClient;
    private final RecordMapper recordMapper;
    private final NotionSyncWriter syncWriter;

    public List<BookRecord> search(String keyword, int maxResults, SyncCredentials credentials) {
        return catalogClient.search(keyword, credentials.aladinApiKey(), maxResults);
    }

    public BookRecord lookup(String isbn, SyncCredentials credentials) {
        return catalogClient.lookup(isbn, credentials.aladinApiKey());
    }

    /**
     * 검색 결과에서 고른 도서를 등록한다.
     * 검색 결과는 일부 필드가 빠져 있을 수 있어서 ISBN 으로 상세 정보를 다시 받아 저장하고,
     * 상세 조회가 실패하면 고른 도서 정보 그대로 저장한다.
     */
    public RegistrationResult registerSelected(BookRecord selected, SyncCredentials credentials) {
        List<String> warnings = new ArrayList<>();
        BookRecord toSave = selected;
        boolean upgraded = false;

        if (selected.source() == RecordSource.LOOKUP) {
            // 이미 상세 정보이므로 그대로 상세 정보로 저장한 것으로 본다
            upgraded = true;
            log.debug("[Registration] 이미 상세 조회된 도서 -> 재조회 생략. isbn={}", selected.preferredIsbn());
        } else if (selected.hasIsbn()) {
            String isbn = BookSyncUtils.cleanIsbn(selected.preferredIsbn());
            try {
                toSave = catalogClient.lookup(isbn, credentials.aladinApiKey());
                upgraded = true;
                log.info("[Registration] 상세 정보로 교체. isbn={}", isbn);
            } catch (ConfigException e) {
                throw e;
            } catch (BookSyncException e) {
                log.warn("[Fallback] 상세 조회 실패 -> 검색 결과로 저장합니다. isbn={}, msg={}", isbn, e.getMessage());
                warnings.add("상세 정보를 가져오지 못해 검색 결과로 저장했습니다: " + e.getMessage());
            }
        } else {
            log.warn("[Fallback] ISBN 없음 -> 검색 결과로 저장합니다. title={}", selected.title());
            warnings.add("ISBN 정보가 없어 검색 결과로 저장했습니다.");
        }

        RegistrationResult saved = save(toSave, upgraded, credentials, warnings);

        // 상세 정보에 링크가 없으면 검색 결과의 링크라도 보여준다
        if (saved.link().isEmpty() && !selected.detailLink().isEmpty()) {
            return saved.toBuilder().link(selected.detailLink()).build();
        }
        return saved;
    }

    // ISBN 으로 바로 조회해서 등록 (조회 실패 시 저장하지 않음)
    public RegistrationResult registerByIsbn(String isbn, SyncCredentials credentials) {
        BookRecord book = catalogClient.lookup(isbn, credentials.aladinApiKey());
        return save(book, true, credentials, new ArrayList<>());
    }

    private RegistrationResult save(BookRecord book, boolean upgraded, SyncCredentials credentials, List<String> warnings) {
        DestinationPayload payload = recordMapper.toPayload(book);
        SyncResult result = syncWriter.create(
                payload,
                credentials.notionApiKey(),
                credentials.notionDatabaseId(),
                book.description()
        );

        if (result.isPartial()) {
            warnings.add(result.warning().getMessage());
        }
        log.info("[Registration] Notion 등록 완료. pageId={}, title={}, partial={}",
                result.recordId(), book.title(), result.isPartial());

        return RegistrationResult.builder()
                .recordId(result.recordId())
                .book(book)
                .detailUpgraded(upgraded)
                .link(book.detailLink())
                .warnings(warnings)
                .build();
    }
}
