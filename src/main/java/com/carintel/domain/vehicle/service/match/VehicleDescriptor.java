package com.carintel.domain.vehicle.service.match;

import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * 제원 매칭 입력 (VIN 디코딩 결과 또는 명시적 연식/제조사/모델/트림)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleDescriptor {

    private Integer year;

    private String make;

    private String model;

    private String trim;

    public boolean hasTrim() {
        return trim != null && !trim.trim().isEmpty();
    }
}
