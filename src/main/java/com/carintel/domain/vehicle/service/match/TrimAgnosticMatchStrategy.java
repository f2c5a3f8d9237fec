package com.carintel.domain.vehicle.service.match;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 연식 + 제조사 + 모델 매칭 (트림 무시)
 */
@Component
@Order(2)
public class TrimAgnosticMatchStrategy implements SpecMatchStrategy {

    @Override
    public String name() {
        return "trim-agnostic";
    }

    @Override
    public Optional<MatchCriteria> criteriaFor(VehicleDescriptor descriptor) {
        return Optional.of(MatchCriteria.builder()
                .year(descriptor.getYear())
                .make(descriptor.getMake())
                .modelPattern(MatchPatterns.modelPattern(descriptor.getModel()))
                .build());
    }
}
