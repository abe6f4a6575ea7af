package com.nhnacademy.booknotionsync.exception;

import lombok.Getter;

@Getter
public class BookNotFoundException extends BookSyncException {

    private final String isbn;

    public BookNotFoundException(String isbn) {
        super(ErrorCode.NOT_FOUND, "도서 정보를 찾을 수 없습니다. ISBN: " + isbn);
        this.isbn = isbn;
    }
}
