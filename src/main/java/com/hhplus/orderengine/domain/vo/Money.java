package com.hhplus.orderengine.domain.vo;

import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode
public class Money implements Serializable, Comparable<Money> {

    private static final int SCALE = 2;

    // 금액 컬럼 precision = 12, scale = 2 의 최대값
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");

    private BigDecimal amount;

    public Money(BigDecimal amount) {
        validateAmount(amount);
        BigDecimal scaled = amount.setScale(SCALE, RoundingMode.HALF_UP);
        if (scaled.compareTo(MAX_AMOUNT) > 0) {
            throw new BusinessException(ErrorCode.INVALID_ARGUMENT, "Amount must not exceed " + MAX_AMOUNT.toPlainString());
        }
        this.amount = scaled;
    }

    private void validateAmount(BigDecimal amount) {
        if (amount == null) {
            throw new BusinessException(ErrorCode.MISSING_FIELDS, "price");
        }
        if (amount.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_ARGUMENT, "Price must be a non-negative number");
        }
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money multiply(int multiplier) {
        return new Money(this.amount.multiply(BigDecimal.valueOf(multiplier)));
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    public static Money of(BigDecimal amount) {
        return new Money(amount);
    }

    public static Money of(String amount) {
        return new Money(new BigDecimal(amount));
    }

    public static Money zero() {
        return new Money(BigDecimal.ZERO);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
