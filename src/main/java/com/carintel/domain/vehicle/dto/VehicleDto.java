package com.carintel.domain.vehicle.dto;

import com.carintel.domain.vehicle.entity.MaintenanceSchedule;
import com.carintel.domain.vehicle.entity.VehicleSpec;
import com.carintel.domain.vehicle.entity.VehicleWarranty;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 차량 조회 데이터 전송 객체
 */
public class VehicleDto {

    /**
     * 연식/제조사/모델/트림 조회 응답 DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class LookupResponse {
        private VehicleSpec specs;
        private List<VehicleWarranty> warranty;
        private Map<String, MarketValueSet> marketValues;
        private List<MaintenanceSchedule> maintenance;

        /**
         * 제원, 보증, 시세, 정비 정보가 모두 비어있는지 여부
         */
        public boolean isEmpty() {
            return specs == null
                    && (warranty == null || warranty.isEmpty())
                    && (marketValues == null || marketValues.isEmpty())
                    && (maintenance == null || maintenance.isEmpty());
        }
    }

    /**
     * VIN 전체 조회 응답 DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VinLookupResponse {
        private DecodedVin vinInfo;
        private VehicleSpec specs;
        private List<VehicleWarranty> warranty;
        private Map<String, MarketValueSet> marketValues;
        private List<MaintenanceSchedule> maintenance;
    }

    /**
     * 상태(condition)별 시세 값
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class MarketValueSet {
        private String condition;
        private Long tradeInCents;
        private Long privatePartyCents;
        private Long dealerRetailCents;
    }

    /**
     * 원시 제원 검색 조건 (/vehicles/specs)
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SpecSearchRequest {
        private Integer year;
        private String make;
        private String model;
        private String trim;
        private int limit;
    }
}
