package com.carintel.common.util;

import com.carintel.common.dto.ApiResponse;
import com.carintel.common.exception.ErrorCode;
import org.springframework.http.ResponseEntity;

/**
 * 응답 관련 유틸리티 클래스
 */
public class ResponseUtils {

    private ResponseUtils() {
    }

    /**
     * 성공 응답 생성
     */
    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .data(data)
                .build();
    }

    /**
     * 실패 응답 생성
     */
    public static <T> ApiResponse<T> error(ErrorCode errorCode, String message) {
        return ApiResponse.<T>builder()
                .error(new ApiResponse.ErrorBody(errorCode.getCode(), message))
                .build();
    }

    /**
     * 에러 코드의 상태값으로 실패 응답 엔티티 생성
     */
    public static <T> ResponseEntity<ApiResponse<T>> errorEntity(ErrorCode errorCode, String message) {
        return ResponseEntity.status(errorCode.getStatus()).body(error(errorCode, message));
    }
}
