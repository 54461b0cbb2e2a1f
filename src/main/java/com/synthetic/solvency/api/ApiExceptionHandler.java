package com.synthetic.solvency.api;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SolvencyException.class)
    public ResponseEntity<Map<String, Object>> handleSolvency(SolvencyException ex) {
        HttpStatus status = statusOf(ex.getCode());
        if (status.is5xxServerError()) {
            log.warn("[API] 요청 실패: code={}, message={}", ex.getCode(), ex.getMessage());
        } else {
            log.debug("[API] 요청 거부: code={}, message={}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(body("MALFORMED_REQUEST", "요청 본문을 읽을 수 없습니다"));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex) {
        log.error("[API] 내부 불변식 위반", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", ex.getMessage()));
    }

    static HttpStatus statusOf(SolvencyErrorCode code) {
        return switch (code) {
            case NOT_AUTHORIZED -> HttpStatus.FORBIDDEN;
            case POSITION_NOT_FOUND, ORACLE_NOT_REGISTERED -> HttpStatus.NOT_FOUND;
            case CONTRACT_PAUSED, STALE_PRICE -> HttpStatus.CONFLICT;
            case TRANSFER_FAILED -> HttpStatus.BAD_GATEWAY;
            case ARITHMETIC_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
            case INSUFFICIENT_COLLATERAL, INVALID_AMOUNT, LIQUIDATION_NOT_ALLOWED,
                    EXCEEDS_MAX_POSITION -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("code", code);
        body.put("message", message);
        return body;
    }
}
