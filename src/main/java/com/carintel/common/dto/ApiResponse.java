package com.carintel.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * 공통 API 응답 DTO
 *
 * 성공 시 {"data": ...}, 실패 시 {"error": {"code", "message"}} 형태로 직렬화
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /**
     * 응답 데이터
     */
    private T data;

    /**
     * 에러 정보 (실패 시)
     */
    private ErrorBody error;

    /**
     * 에러 상세
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorBody {
        private String code;
        private String message;
    }
}
