package com.nhnacademy.booknotionsync.controller;

import com.nhnacademy.booknotionsync.catalog.dto.BookRecord;
import com.nhnacademy.booknotionsync.config.OpenApiConfig;
import com.nhnacademy.booknotionsync.dto.RegisterRequest;
import com.nhnacademy.booknotionsync.dto.RegistrationResult;
import com.nhnacademy.booknotionsync.dto.SyncCredentials;
import com.nhnacademy.booknotionsync.service.BookRegistrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = OpenApiConfig.BOOK_TAG)
@RestController
@RequestMapping("/api/books")
@RequiredArgsConstructor
public class BookSyncController {

    static final String ALADIN_KEY_HEADER = "X-Aladin-Key";
    static final String NOTION_TOKEN_HEADER = "X-Notion-Token";
    static final String NOTION_DATABASE_HEADER = "X-Notion-Database";

    private final BookRegistrationService registrationService;
    private final CredentialResolver credentialResolver;

    // 키워드 검색
    @GetMapping("/search")
    @Operation(summary = "도서 키워드 검색", description = "제목, 저자 등 키워드로 알라딘에서 도서를 검색합니다.")
    public List<BookRecord> search(
            @Parameter(description = "검색어", example = "클린 코드")
            @RequestParam String query,
            @Parameter(description = "최대 결과 수 (1~100)", example = "10")
            @RequestParam(defaultValue = "10") int maxResults,
            @RequestHeader(value = ALADIN_KEY_HEADER, required = false) String aladinKey
    ) {
        SyncCredentials credentials = credentialResolver.resolve(aladinKey, null, null);
        return registrationService.search(query, maxResults, credentials);
    }

    // ISBN 상세 조회
    @GetMapping("/isbn/{isbn}")
    @Operation(summary = "ISBN 상세 조회", description = "ISBN-10 또는 ISBN-13으로 도서 상세 정보를 조회합니다.")
    public BookRecord lookup(
            @Parameter(description = "ISBN (하이픈 허용)", example = "978-89-6626-077-6")
            @PathVariable String isbn,
            @RequestHeader(value = ALADIN_KEY_HEADER, required = false) String aladinKey
    ) {
        SyncCredentials credentials = credentialResolver.resolve(aladinKey, null, null);
        return registrationService.lookup(isbn, credentials);
    }

    // 검색 결과에서 고른 도서 등록
    @PostMapping("/notion")
    @Operation(summary = "선택한 도서 Notion 등록", description = "ISBN으로 상세 정보를 다시 조회한 뒤 Notion 데이터베이스에 새 페이지로 등록합니다.")
    public RegistrationResult register(
            @Valid @RequestBody RegisterRequest request,
            @RequestHeader(value = ALADIN_KEY_HEADER, required = false) String aladinKey,
            @RequestHeader(value = NOTION_TOKEN_HEADER, required = false) String notionToken,
            @RequestHeader(value = NOTION_DATABASE_HEADER, required = false) String notionDatabase
    ) {
        SyncCredentials credentials = credentialResolver.resolve(aladinKey, notionToken, notionDatabase);
        return registrationService.registerSelected(request.book(), credentials);
    }

    // ISBN 으로 바로 등록
    @PostMapping("/notion/isbn/{isbn}")
    @Operation(summary = "ISBN으로 Notion 등록", description = "ISBN으로 도서를 조회해 바로 Notion에 등록합니다.")
    public RegistrationResult registerByIsbn(
            @PathVariable String isbn,
            @RequestHeader(value = ALADIN_KEY_HEADER, required = false) String aladinKey,
            @RequestHeader(value = NOTION_TOKEN_HEADER, required = false) String notionToken,
            @RequestHeader(value = NOTION_DATABASE_HEADER, required = false) String notionDatabase
    ) {
        SyncCredentials credentials = credentialResolver.resolve(aladinKey, notionToken, notionDatabase);
        return registrationService.registerByIsbn(isbn, credentials);
    }
}
