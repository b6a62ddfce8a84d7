package com.hhplus.orderengine.domain.vo;

import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 상품 재고 (음수 불가)
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode
public class Stock implements Serializable {

    private Integer quantity;

    public Stock(Integer quantity) {
        if (quantity == null || quantity < 0) {
            throw new BusinessException(ErrorCode.INVALID_ARGUMENT, "Stock must be a non-negative integer");
        }
        this.quantity = quantity;
    }

    public static Stock of(Integer quantity) {
        return new Stock(quantity);
    }

    public static Stock empty() {
        return new Stock(0);
    }

    /**
     * 증감량을 적용한 결과가 0 이상, int 최대값 이하인지 확인
     */
    public boolean canApply(int delta) {
        long result = (long) quantity + delta;
        return result >= 0 && result <= Integer.MAX_VALUE;
    }

    /**
     * 증감량을 적용하면 int 범위를 넘는지 확인
     */
    public boolean exceedsLimit(int delta) {
        return (long) quantity + delta > Integer.MAX_VALUE;
    }

    /**
     * 증감량 적용 (delta 음수: 차감, 양수: 복구/입고)
     *
     * @throws IllegalStateException 적용 결과가 음수이거나 int 범위를 넘는 경우
     */
    public Stock apply(int delta) {
        if (!canApply(delta)) {
            throw new IllegalStateException("재고 범위를 벗어납니다: " + quantity + " + (" + delta + ")");
        }
        return new Stock(quantity + delta);
    }

    public boolean isSufficientFor(Quantity required) {
        return quantity >= required.getValue();
    }

    @Override
    public String toString() {
        return String.valueOf(quantity);
    }
}
