package com.carintel.domain.vehicle.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * 정비 일정 엔티티 (vehicle_maintenance_schedules)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MaintenanceSchedule {

    private UUID id;

    private Integer year;

    private String make;

    private String model;

    private String trim;

    /**
     * 정비 시점 주행거리 (마일)
     */
    private Integer mileage;

    private Integer months;

    private List<String> serviceItems;
}
