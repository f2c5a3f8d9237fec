package com.carintel.domain.vehicle.exception;

import com.carintel.common.exception.BusinessException;
import com.carintel.common.exception.ErrorCode;

/**
 * VIN 디코딩 실패 예외
 *
 * 업스트림 장애(UPSTREAM_UNAVAILABLE)와 디코딩 불가(DECODE_FAILED)를 구분
 */
public class VinDecodeException extends BusinessException {

    public VinDecodeException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public VinDecodeException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static VinDecodeException upstreamUnavailable(String message, Throwable cause) {
        return new VinDecodeException(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
    }

    public static VinDecodeException decodeFailed(String message) {
        return new VinDecodeException(ErrorCode.DECODE_FAILED, message);
    }

    public static VinDecodeException decodeFailed(String message, Throwable cause) {
        return new VinDecodeException(ErrorCode.DECODE_FAILED, message, cause);
    }
}
