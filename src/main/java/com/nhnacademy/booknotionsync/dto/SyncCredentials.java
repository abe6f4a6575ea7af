package com.nhnacademy.booknotionsync.dto;

/**
 * 한 번의 요청에 쓰는 자격 정보. 서버에 저장하지 않고 호출마다 넘긴다.
 */
public record SyncCredentials(String aladinApiKey, String notionApiKey, String notionDatabaseId) {

    @Override
    public String toString() {
        return "SyncCredentials[aladinApiKey=" + mask(aladinApiKey)
                + ", notionApiKey=" + mask(notionApiKey)
                + ", notionDatabaseId=" + notionDatabaseId + "]";
    }

    private static String mask(String secret) {
        return (secret == null || secret.isEmpty()) ? "<empty>" : "****";
    }
}
