package com.carintel.domain.vehicle.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.UUID;

/**
 * 차량 보증 엔티티 (vehicle_warranties)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VehicleWarranty {

    private UUID id;

    private UUID vehicleSpecId;

    /**
     * 보증 유형 (basic, powertrain, corrosion, roadside_assistance ...)
     */
    private String warrantyType;

    private Integer months;

    private Integer miles;

    private String details;
}
