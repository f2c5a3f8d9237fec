package com.carintel.domain.vehicle.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 차량 제원 엔티티 (vehicle_specs)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VehicleSpec {

    private UUID id;

    private Integer year;

    private String make;

    private String model;

    private String trim;

    private String bodyType;

    // 엔진/변속기
    private String engine;

    private Integer cylinders;

    private BigDecimal displacementLiters;

    private Integer horsepower;

    private Integer torqueLbFt;

    private String transmission;

    private String drivetrain;

    private String fuelType;

    // 연비
    private Integer mpgCity;

    private Integer mpgHighway;

    private Integer mpgCombined;

    private Long msrpCents;

    private String sampleVin;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;
}
