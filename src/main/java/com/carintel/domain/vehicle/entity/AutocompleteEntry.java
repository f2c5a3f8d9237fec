package com.carintel.domain.vehicle.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * 자동완성 검색 결과 (vehicle_autocomplete 뷰 또는 vehicle_specs 대체 조회)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AutocompleteEntry {

    private Integer year;

    private String make;

    private String model;

    private String displayText;

    private String sampleVin;
}
