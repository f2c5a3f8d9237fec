package com.carintel.domain.vehicle.service;

import com.carintel.config.VehicleApiProperties;
import com.carintel.domain.vehicle.dto.VehicleDto;
import com.carintel.domain.vehicle.entity.VehicleMarketValue;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarketValueFormatterTest {

    private final MarketValueFormatter formatter = new MarketValueFormatter(
            new VehicleApiProperties(),
            Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void shouldKeyByConditionWithLastRowWinning() {
        // Given
        List<VehicleMarketValue> rows = List.of(
                row("Clean", 1_500_000L),
                row("Average", 1_300_000L),
                row("Clean", 1_550_000L));

        // When
        Map<String, VehicleDto.MarketValueSet> values = formatter.format(rows);

        // Then
        assertEquals(List.of("Clean", "Average"), List.copyOf(values.keySet()));
        assertEquals(1_550_000L, values.get("Clean").getTradeInCents());
    }

    @Test
    void shouldReduceValuesForMileageAboveExpectation() {
        // Given: 2020년식 5년 경과, 기대 주행거리 60,000
        Map<String, VehicleDto.MarketValueSet> values = formatter.format(List.of(
                VehicleMarketValue.builder().condition("Clean")
                        .tradeInCents(1_500_000L).privatePartyCents(null).dealerRetailCents(1_900_000L).build()));

        // When
        Map<String, VehicleDto.MarketValueSet> adjusted = formatter.adjustForMileage(values, 2020, 70_000);

        // Then
        VehicleDto.MarketValueSet clean = adjusted.get("Clean");
        assertEquals(1_400_000L, clean.getTradeInCents());
        assertNull(clean.getPrivatePartyCents());
        assertEquals(1_800_000L, clean.getDealerRetailCents());
    }

    @Test
    void shouldIncreaseValuesForMileageBelowExpectation() {
        assertEquals(200_000L, formatter.mileageAdjustmentCents(2020, 40_000));
    }

    @Test
    void shouldLeaveValuesUntouchedAtExpectedMileage() {
        Map<String, VehicleDto.MarketValueSet> values = formatter.format(List.of(row("Rough", 900_000L)));

        assertSame(values, formatter.adjustForMileage(values, 2020, 60_000));
    }

    private static VehicleMarketValue row(String condition, long tradeIn) {
        return VehicleMarketValue.builder()
                .condition(condition)
                .tradeInCents(tradeIn)
                .privatePartyCents(tradeIn + 200_000L)
                .dealerRetailCents(tradeIn + 400_000L)
                .build();
    }
}
