package com.hhplus.orderengine.domain.enums;

import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 주문 상태
 *
 * pending → processing → shipped → delivered 가 정상 흐름이며,
 * cancelled 는 delivered 이전 상태에서만 도달할 수 있습니다.
 * 정방향 순서는 강제하지 않습니다 (pending 에서 shipped 로 바로 변경 가능).
 */
@Getter
@RequiredArgsConstructor
public enum OrderStatus {
    PENDING("pending", "주문 접수"),
    PROCESSING("processing", "처리 중"),
    SHIPPED("shipped", "배송 중"),
    DELIVERED("delivered", "배송 완료"),
    CANCELLED("cancelled", "취소됨");

    private final String value;
    private final String description;

    /**
     * 외부 입력 문자열을 상태로 변환
     *
     * @throws BusinessException 인식할 수 없는 값인 경우 (INVALID_STATUS)
     */
    public static OrderStatus from(String value) {
        if (value == null) {
            throw invalidStatus();
        }
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(OrderStatus::invalidStatus);
    }

    /**
     * 더 이상 상태를 변경할 수 없는 종료 상태인지
     */
    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /**
     * 취소(재고 복구 + 주문 삭제) 가능 여부
     */
    public boolean isCancellable() {
        return this != DELIVERED;
    }

    public static String allowedValues() {
        return Arrays.stream(values())
                .map(OrderStatus::getValue)
                .collect(Collectors.joining(", "));
    }

    private static BusinessException invalidStatus() {
        return new BusinessException(ErrorCode.INVALID_STATUS, allowedValues());
    }
}
