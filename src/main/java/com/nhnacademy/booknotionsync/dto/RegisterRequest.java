package com.nhnacademy.booknotionsync.dto;

import com.nhnacademy.booknotionsync.catalog.dto.BookRecord;
import jakarta.validation.constraints.NotNull;

public record RegisterRequest(
        @NotNull(message = "등록할 도서 정보가 없습니다.")
        BookRecord book
) {}
