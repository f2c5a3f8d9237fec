package com.carintel.common.exception;

import org.springframework.http.HttpStatus;

/**
 * API 에러 코드
 *
 * 응답 본문의 error.code 값과 HTTP 상태 코드를 함께 정의
 */
public enum ErrorCode {

    INVALID_VIN("invalid_vin", HttpStatus.BAD_REQUEST),
    MISSING_PARAMS("missing_params", HttpStatus.BAD_REQUEST),
    INVALID_PARAMS("invalid_params", HttpStatus.BAD_REQUEST),
    DECODE_FAILED("decode_failed", HttpStatus.BAD_REQUEST),
    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    METHOD_NOT_ALLOWED("method_not_allowed", HttpStatus.METHOD_NOT_ALLOWED),
    GONE("gone", HttpStatus.GONE),
    RATE_LIMITED("rate_limited", HttpStatus.TOO_MANY_REQUESTS),
    QUOTA_EXCEEDED("quota_exceeded", HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR("internal_error", HttpStatus.INTERNAL_SERVER_ERROR),
    UPSTREAM_UNAVAILABLE("upstream_unavailable", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final HttpStatus status;

    ErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
