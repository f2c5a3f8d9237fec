package com.carintel.domain.vehicle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * VIN 디코딩 결과
 *
 * 외부 디코더 응답에서 검증할 수 없는 값은 null로 채움
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DecodedVin {

    private String vin;

    private Integer year;

    private String make;

    private String model;

    private String trim;

    private String bodyType;

    private String vehicleType;

    private Integer doors;

    private Engine engine;

    private String drivetrain;

    private String transmission;

    private String manufacturer;

    private String plantCountry;

    private String plantCity;

    private String errorCode;

    private String errorText;

    /**
     * 디코더가 "0" 이외의 에러 코드를 반환한 경우의 경고 메시지 (없으면 생략)
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String warning;

    /**
     * 연식/제조사/모델이 모두 디코딩되었는지 여부
     */
    public boolean hasVehicleIdentity() {
        return year != null && make != null && model != null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Engine {
        private Integer cylinders;
        private String displacement;
        private Integer horsepower;
        private String fuelType;
    }
}
