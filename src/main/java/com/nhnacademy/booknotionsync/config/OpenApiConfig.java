package com.nhnacademy.booknotionsync.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Book Notion Sync API",
                version = "v1",
                description = "알라딘 도서 검색 및 Notion 등록 API 문서. "
                        + "X-Aladin-Key, X-Notion-Token, X-Notion-Database 헤더가 없으면 서버에 설정된 값을 사용합니다."
        ),
        tags = @Tag(name = OpenApiConfig.BOOK_TAG, description = "도서 검색과 Notion 데이터베이스 등록")
)
public class OpenApiConfig {

    public static final String BOOK_TAG = "Books";
}
