package com.carintel.domain.vehicle.entity;

import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.UUID;

/**
 * 차량 시세 엔티티 (vehicle_market_values)
 *
 * (year, make, model, trim, condition) 단위의 시세 행
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleMarketValue {

    private UUID id;

    private Integer year;

    private String make;

    private String model;

    private String trim;

    private String condition;

    private Long tradeInCents;

    private Long privatePartyCents;

    private Long dealerRetailCents;
}
