package com.hhplus.orderengine.domain.exception;

import lombok.Getter;

/**
 * 비즈니스 규칙 위반 예외
 *
 * 트랜잭션 롤백 이후 연산 경계에서 호출자에게 전달됩니다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode, Object... args) {
        super(errorCode.format(args));
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(errorCode.format(args), cause);
        this.errorCode = errorCode;
    }
}
