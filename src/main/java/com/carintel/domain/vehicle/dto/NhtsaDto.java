package com.carintel.domain.vehicle.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;

/**
 * NHTSA vPIC API DTO 클래스들
 */
public class NhtsaDto {

    /**
     * decodevin 응답
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DecodeResponse {

        @JsonProperty("Count")
        private Integer count;

        @JsonProperty("Message")
        private String message;

        @JsonProperty("SearchCriteria")
        private String searchCriteria;

        @JsonProperty("Results")
        private List<Result> results;
    }

    /**
     * 변수/값 한 쌍
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {

        @JsonProperty("Variable")
        private String variable;

        @JsonProperty("Value")
        private String value;

        @JsonProperty("VariableId")
        private Integer variableId;

        @JsonProperty("ValueId")
        private String valueId;
    }
}
