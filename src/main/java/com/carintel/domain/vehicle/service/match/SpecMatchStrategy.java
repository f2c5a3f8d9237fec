package com.carintel.domain.vehicle.service.match;

import java.util.Optional;

/**
 * 제원 매칭 전략
 *
 * 순서대로 평가되며, 적용 불가한 전략은 조건을 만들지 않는다
 */
public interface SpecMatchStrategy {

    /**
     * 로그용 전략 이름
     */
    String name();

    /**
     * 입력으로부터 조회 조건 생성 (적용 불가 시 empty)
     */
    Optional<MatchCriteria> criteriaFor(VehicleDescriptor descriptor);
}
