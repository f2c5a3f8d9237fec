package com.carintel.domain.vehicle.exception;

import com.carintel.common.exception.BusinessException;
import com.carintel.common.exception.ErrorCode;

/**
 * 차량을 찾을 수 없음 예외
 */
public class VehicleNotFoundException extends BusinessException {

    private static final String DEFAULT_MESSAGE = "Vehicle not found";

    public VehicleNotFoundException() {
        super(ErrorCode.NOT_FOUND, DEFAULT_MESSAGE);
    }

    public VehicleNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
