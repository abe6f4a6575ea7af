package com.nhnacademy.booknotionsync.controller;

import com.nhnacademy.booknotionsync.dto.SyncCredentials;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 요청 헤더의 자격 정보를 우선 쓰고, 없으면 환경 변수로 설정된 기본값을 쓴다.
 */
@Component
public class CredentialResolver {

    @Value("${app.credentials.aladin-api-key:}")
    private String defaultAladinApiKey;

    @Value("${app.credentials.notion-api-key:}")
    private String defaultNotionApiKey;

    @Value("${app.credentials.notion-database-id:}")
    private String defaultNotionDatabaseId;

    public SyncCredentials resolve(String aladinApiKey, String notionApiKey, String notionDatabaseId) {
        return new SyncCredentials(
                firstNonBlank(aladinApiKey, defaultAladinApiKey),
                firstNonBlank(notionApiKey, defaultNotionApiKey),
                firstNonBlank(notionDatabaseId, defaultNotionDatabaseId)
        );
    }

    private String firstNonBlank(String value, String fallback) {
        if (value != null && !value.isBlank()) return value.trim();
        return fallback == null ? "" : fallback.trim();
    }
}
