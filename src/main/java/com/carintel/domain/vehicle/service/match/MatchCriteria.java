package com.carintel.domain.vehicle.service.match;

import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * 매퍼에 전달되는 ILIKE 조회 조건
 *
 * make는 대소문자 무시 일치, model/trim은 ILIKE 패턴 (trimPattern이 null이면 트림 무시)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchCriteria {

    private Integer year;

    private String make;

    private String modelPattern;

    private String trimPattern;
}
