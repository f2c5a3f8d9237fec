package com.carintel.domain.vehicle.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * 시세 차량 상태 구분
 */
public enum MarketCondition {

    OUTSTANDING("Outstanding"),
    CLEAN("Clean"),
    AVERAGE("Average"),
    ROUGH("Rough");

    private final String label;

    MarketCondition(String label) {
        this.label = label;
    }

    /**
     * 저장소/응답에서 사용하는 표기 ("Clean")
     */
    public String getLabel() {
        return label;
    }

    /**
     * 대소문자 무시 조회
     */
    public static Optional<MarketCondition> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(condition -> condition.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
