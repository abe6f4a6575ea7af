package com.nhnacademy.booknotionsync.dto;

import com.nhnacademy.booknotionsync.catalog.dto.BookRecord;
import lombok.Builder;

import java.util.List;

/**
 * Notion 등록 결과.
 *
 * @param recordId       생성된 Notion 페이지 id
 * @param book           실제로 저장한 도서 정보 (상세 조회에 성공했다면 상세 정보)
 * @param detailUpgraded 상세 조회 결과로 저장했는지 여부 (처음부터 상세 조회된 도서도 true)
 * @param link           알라딘 상품 페이지 링크 (없으면 빈 문자열)
 * @param warnings       저장은 됐지만 사용자에게 알려야 할 내용
 */
@Builder(toBuilder = true)
public record RegistrationResult(
        String recordId,
        BookRecord book,
        boolean detailUpgraded,
        String link,
        List<String> warnings
) {
    public RegistrationResult {
        link = link == null ? "" : link;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
