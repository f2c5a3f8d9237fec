package com.carintel.domain.vehicle.exception;

import com.carintel.common.exception.BusinessException;
import com.carintel.common.exception.ErrorCode;

/**
 * 잘못된 차량 조회 요청 예외 (VIN 형식, 파라미터 누락/형식 오류)
 */
public class InvalidVehicleRequestException extends BusinessException {

    public InvalidVehicleRequestException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static InvalidVehicleRequestException invalidVin(String message) {
        return new InvalidVehicleRequestException(ErrorCode.INVALID_VIN, message);
    }

    public static InvalidVehicleRequestException missingParams(String message) {
        return new InvalidVehicleRequestException(ErrorCode.MISSING_PARAMS, message);
    }

    public static InvalidVehicleRequestException invalidParams(String message) {
        return new InvalidVehicleRequestException(ErrorCode.INVALID_PARAMS, message);
    }
}
