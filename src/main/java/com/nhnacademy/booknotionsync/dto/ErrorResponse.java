package com.nhnacademy.booknotionsync.dto;

public record ErrorResponse(String code, String message) {}
