package com.carintel.domain.vehicle.service.match;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 연식 + 제조사 + 모델 + 대표 트림 접두어 매칭
 */
@Component
@Order(1)
public class TrimPrefixMatchStrategy implements SpecMatchStrategy {

    @Override
    public String name() {
        return "trim-prefix";
    }

    @Override
    public Optional<MatchCriteria> criteriaFor(VehicleDescriptor descriptor) {
        String trimPattern = MatchPatterns.trimPrefixPattern(descriptor.getTrim());
        if (trimPattern == null) {
            return Optional.empty();
        }

        return Optional.of(MatchCriteria.builder()
                .year(descriptor.getYear())
                .make(descriptor.getMake())
                .modelPattern(MatchPatterns.modelPattern(descriptor.getModel()))
                .trimPattern(trimPattern)
                .build());
    }
}
