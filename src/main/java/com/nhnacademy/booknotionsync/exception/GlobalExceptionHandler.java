package com.nhnacademy.booknotionsync.exception;

import com.nhnacademy.booknotionsync.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // 1. @Valid 유효성 검사 실패
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException e) {
        String errorMessage = e.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", "요청 데이터 오류: " + errorMessage));
    }

    // 2. 잘못된 입력 (빈 검색어, ISBN 형식 등)
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        log.warn("잘못된 요청: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    // 3. 도서 등록 파이프라인 오류
    @ExceptionHandler(BookSyncException.class)
    public ResponseEntity<ErrorResponse> handleBookSync(BookSyncException e) {
        HttpStatus status = switch (e.getErrorCode()) {
            case CONFIG -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case TRANSPORT, MALFORMED_RESPONSE, CATALOG_API -> HttpStatus.BAD_GATEWAY;
            case PARTIAL_WRITE -> HttpStatus.OK;
        };

        if (status == HttpStatus.BAD_GATEWAY) {
            log.warn("외부 API 오류 [{}]: {}", e.getErrorCode(), e.getMessage());
        } else {
            log.info("요청 처리 실패 [{}]: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode().name(), e.getMessage()));
    }

    // 4. 그 외 알 수 없는 서버 에러
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception e) {
        log.error("서버 내부 오류 발생", e);
        return ResponseEntity.internalServerError()
                .body(new ErrorResponse("INTERNAL_ERROR", "서버 처리 중 오류가 발생했습니다: " + e.getMessage()));
    }
}
