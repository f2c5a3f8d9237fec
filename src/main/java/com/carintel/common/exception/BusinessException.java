package com.carintel.common.exception;

/**
 * 비즈니스 로직 예외
 *
 * 애플리케이션에서 발생하는 비즈니스 관련 예외를 처리하며,
 * 응답에 사용할 에러 코드를 함께 보관
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
