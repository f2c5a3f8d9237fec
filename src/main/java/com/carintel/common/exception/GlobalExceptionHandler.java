package com.carintel.common.exception;

import com.carintel.common.dto.ApiResponse;
import com.carintel.common.util.ResponseUtils;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 전역 예외 처리기
 *
 * 업스트림/데이터스토어 오류는 상세 내용을 로그로만 남기고
 * 호출자에게는 일반화된 메시지만 반환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred";
    private static final String UPSTREAM_ERROR_MESSAGE = "Vehicle decoding service is temporarily unavailable";

    /**
     * BusinessException 처리 - 에러 코드에 정의된 상태값 사용
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException ex) {
        ErrorCode errorCode = ex.getErrorCode();

        if (errorCode == ErrorCode.UPSTREAM_UNAVAILABLE) {
            log.error("Upstream failure: {}", ex.getMessage(), ex.getCause());
            return ResponseUtils.errorEntity(errorCode, UPSTREAM_ERROR_MESSAGE);
        }

        if (errorCode == ErrorCode.INTERNAL_ERROR) {
            log.error("Internal failure: {}", ex.getMessage(), ex.getCause());
            return ResponseUtils.errorEntity(errorCode, INTERNAL_ERROR_MESSAGE);
        }

        log.warn("Business exception occurred: [{}] {}", errorCode.getCode(), ex.getMessage());
        return ResponseUtils.errorEntity(errorCode, ex.getMessage());
    }

    /**
     * 필수 쿼리 파라미터 누락 - 400 Bad Request
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing request parameter: {}", ex.getParameterName());

        return ResponseUtils.errorEntity(ErrorCode.MISSING_PARAMS,
                String.format("%s is required", ex.getParameterName()));
    }

    /**
     * 타입 변환 예외 처리 - 400 Bad Request
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch exception occurred: {}", ex.getMessage());

        String requiredType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "valid";
        String message = String.format("%s must be a %s value", ex.getName(), requiredType.toLowerCase());

        return ResponseUtils.errorEntity(ErrorCode.INVALID_PARAMS, message);
    }

    /**
     * HTTP 메서드 지원하지 않음 예외 처리 - 405 Method Not Allowed
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupportedException(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not supported exception occurred: {}", ex.getMessage());

        return ResponseUtils.errorEntity(ErrorCode.METHOD_NOT_ALLOWED, "Only GET requests are supported");
    }

    /**
     * 매핑되지 않은 경로 - 404 Not Found
     * (정적 리소스 처리 여부에 따라 두 예외 중 하나가 발생)
     */
    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnknownPath(ServletException ex) {
        log.debug("No handler for request: {}", ex.getMessage());

        return ResponseUtils.errorEntity(ErrorCode.NOT_FOUND, "Unknown endpoint");
    }

    /**
     * 데이터스토어 예외 처리 - 500 Internal Server Error
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccessException(DataAccessException ex) {
        log.error("Datastore exception occurred: ", ex);

        return ResponseUtils.errorEntity(ErrorCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
    }

    /**
     * 기타 모든 예외 처리 - 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneralException(Exception ex) {
        log.error("Unexpected exception occurred: ", ex);

        return ResponseUtils.errorEntity(ErrorCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
    }
}
