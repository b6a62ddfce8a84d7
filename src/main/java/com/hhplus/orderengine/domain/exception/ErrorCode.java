package com.hhplus.orderengine.domain.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 주문 엔진 에러 코드
 *
 * 호출 계층이 응답을 구분할 수 있도록 코드별로 고정된 메시지 템플릿과 HTTP 상태를 가집니다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "Product not found: %s"),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),

    MISSING_FIELDS(HttpStatus.BAD_REQUEST, "Missing required fields: %s"),
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST, "%s"),
    INVALID_STATUS(HttpStatus.BAD_REQUEST, "Invalid status. Must be one of: %s"),

    INSUFFICIENT_STOCK(HttpStatus.CONFLICT, "Insufficient stock for product: %s"),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT, "Order status cannot change from %s"),
    CANNOT_CANCEL_DELIVERED(HttpStatus.CONFLICT, "Cannot cancel delivered order"),
    PRODUCT_IN_USE(HttpStatus.CONFLICT, "Product is referenced by existing orders: %s"),

    // 락 대기 초과 (부분 변경 없음, 재시도 가능)
    LOCK_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "Stock is busy, please retry");

    private final HttpStatus status;
    private final String messageTemplate;

    public String format(Object... args) {
        return args.length == 0 ? messageTemplate : String.format(messageTemplate, args);
    }
}
