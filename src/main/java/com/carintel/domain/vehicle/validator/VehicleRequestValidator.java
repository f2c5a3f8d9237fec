package com.carintel.domain.vehicle.validator;

import com.carintel.domain.vehicle.dto.MarketCondition;
import com.carintel.domain.vehicle.exception.InvalidVehicleRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 차량 조회 요청 파라미터 검증
 *
 * 모든 검증은 외부 호출/DB 조회 이전에 수행
 */
@Slf4j
@Component
public class VehicleRequestValidator {

    // VIN 번호 정규식 패턴 (17자리 영숫자, I/O/Q 제외)
    private static final Pattern VIN_PATTERN = Pattern.compile("^[A-HJ-NPR-Z0-9]{17}$");

    private static final int VIN_LENGTH = 17;

    private static final int MIN_QUERY_LENGTH = 2;

    /**
     * VIN 검증 후 정규화 (공백 제거, 대문자)
     */
    public String normalizeVin(String vin) {
        String normalized = vin == null ? "" : vin.trim().toUpperCase(Locale.ROOT);

        if (normalized.length() != VIN_LENGTH) {
            throw InvalidVehicleRequestException.invalidVin("VIN must be exactly 17 characters");
        }

        if (!VIN_PATTERN.matcher(normalized).matches()) {
            throw InvalidVehicleRequestException.invalidVin("VIN contains invalid characters");
        }

        return normalized;
    }

    /**
     * 제원 ID(UUID) 검증
     */
    public UUID parseSpecId(String id) {
        try {
            return UUID.fromString(id == null ? "" : id.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Invalid vehicle id: {}", id);
            throw InvalidVehicleRequestException.invalidParams("id must be a valid UUID");
        }
    }

    /**
     * 필수 문자열 파라미터
     */
    public String requireText(String name, String value) {
        if (isBlank(value)) {
            throw InvalidVehicleRequestException.missingParams(name + " is required");
        }
        return value.trim();
    }

    /**
     * 선택 문자열 파라미터 (공백이면 null)
     */
    public String optionalText(String value) {
        return isBlank(value) ? null : value.trim();
    }

    /**
     * 필수 연식
     */
    public int requireYear(String year) {
        if (isBlank(year)) {
            throw InvalidVehicleRequestException.missingParams("year is required");
        }
        return parseInteger("year", year);
    }

    /**
     * 선택 연식 (없으면 null)
     */
    public Integer optionalYear(String year) {
        return isBlank(year) ? null : parseInteger("year", year);
    }

    /**
     * 0 이상의 정수 파라미터 (mileage, current_mileage)
     */
    public Integer optionalNonNegative(String name, String value) {
        if (isBlank(value)) {
            return null;
        }
        int parsed = parseInteger(name, value);
        if (parsed < 0) {
            throw InvalidVehicleRequestException.invalidParams(name + " must be a non-negative integer");
        }
        return parsed;
    }

    /**
     * 조회 개수 제한 (기본값 적용, 최대값으로 절삭)
     */
    public int limit(String value, int defaultLimit, int maxLimit) {
        if (isBlank(value)) {
            return defaultLimit;
        }
        int parsed = parseInteger("limit", value);
        if (parsed < 1) {
            throw InvalidVehicleRequestException.invalidParams("limit must be a positive integer");
        }
        return Math.min(parsed, maxLimit);
    }

    /**
     * 시세 상태 검증 (표준 표기로 정규화)
     */
    public MarketCondition optionalCondition(String condition) {
        if (isBlank(condition)) {
            return null;
        }
        return MarketCondition.fromLabel(condition)
                .orElseThrow(() -> InvalidVehicleRequestException.invalidParams(
                        "condition must be one of Outstanding, Clean, Average, Rough"));
    }

    /**
     * 검색어 검증 (2자 이상)
     */
    public String searchQuery(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.length() < MIN_QUERY_LENGTH) {
            throw InvalidVehicleRequestException.invalidParams("Query must be at least 2 characters");
        }
        return trimmed;
    }

    private int parseInteger(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw InvalidVehicleRequestException.invalidParams(name + " must be a valid integer");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
