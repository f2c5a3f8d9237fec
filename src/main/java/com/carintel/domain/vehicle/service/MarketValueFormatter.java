package com.carintel.domain.vehicle.service;

import com.carintel.config.VehicleApiProperties;
import com.carintel.domain.vehicle.dto.VehicleDto;
import com.carintel.domain.vehicle.entity.VehicleMarketValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 시세 행을 상태(condition)별 맵으로 변환하고 주행거리 보정을 적용
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketValueFormatter {

    private final VehicleApiProperties properties;
    private final Clock clock;

    /**
     * 상태별 시세 맵 생성 (입력 순서 유지, 동일 상태는 나중 행이 덮어씀)
     */
    public Map<String, VehicleDto.MarketValueSet> format(List<VehicleMarketValue> records) {
        Map<String, VehicleDto.MarketValueSet> result = new LinkedHashMap<>();
        if (records == null) {
            return result;
        }

        for (VehicleMarketValue record : records) {
            result.put(record.getCondition(), VehicleDto.MarketValueSet.builder()
                    .condition(record.getCondition())
                    .tradeInCents(record.getTradeInCents())
                    .privatePartyCents(record.getPrivatePartyCents())
                    .dealerRetailCents(record.getDealerRetailCents())
                    .build());
        }
        return result;
    }

    /**
     * 주행거리 보정
     *
     * 연간 기대 주행거리 대비 초과분은 감액, 미달분은 증액 (null 값은 유지)
     */
    public Map<String, VehicleDto.MarketValueSet> adjustForMileage(Map<String, VehicleDto.MarketValueSet> values,
                                                                   int vehicleYear,
                                                                   long actualMileage) {
        long adjustment = mileageAdjustmentCents(vehicleYear, actualMileage);
        if (adjustment == 0) {
            return values;
        }

        Map<String, VehicleDto.MarketValueSet> adjusted = new LinkedHashMap<>();
        values.forEach((condition, set) -> adjusted.put(condition, set.toBuilder()
                .tradeInCents(add(set.getTradeInCents(), adjustment))
                .privatePartyCents(add(set.getPrivatePartyCents(), adjustment))
                .dealerRetailCents(add(set.getDealerRetailCents(), adjustment))
                .build()));
        return adjusted;
    }

    /**
     * 보정 금액 (센트)
     */
    public long mileageAdjustmentCents(int vehicleYear, long actualMileage) {
        VehicleApiProperties.MarketValue config = properties.getMarketValue();

        int currentYear = LocalDate.now(clock).getYear();
        long expectedMileage = (long) (currentYear - vehicleYear) * config.getMilesPerYear();
        long adjustment = -(actualMileage - expectedMileage) * config.getCentsPerMile();

        log.debug("Mileage adjustment: year={}, actual={}, expected={}, cents={}",
                vehicleYear, actualMileage, expectedMileage, adjustment);
        return adjustment;
    }

    private static Long add(Long value, long adjustment) {
        return value == null ? null : value + adjustment;
    }
}
