package com.hhplus.orderengine.domain.vo;

import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 주문 라인 수량 (항상 1 이상)
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode
public class Quantity implements Serializable {

    private Integer value;

    public Quantity(Integer value) {
        validateValue(value);
        this.value = value;
    }

    private void validateValue(Integer value) {
        if (value == null) {
            throw new BusinessException(ErrorCode.MISSING_FIELDS, "quantity");
        }
        if (value <= 0) {
            throw new BusinessException(ErrorCode.INVALID_ARGUMENT, "Quantity must be greater than zero");
        }
    }

    public static Quantity of(Integer value) {
        return new Quantity(value);
    }

    public Money multiply(Money unitPrice) {
        return unitPrice.multiply(this.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
