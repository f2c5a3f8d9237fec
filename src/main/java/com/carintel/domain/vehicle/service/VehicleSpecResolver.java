package com.carintel.domain.vehicle.service;

import com.carintel.domain.vehicle.entity.VehicleSpec;
import com.carintel.domain.vehicle.repository.VehicleSpecRepository;
import com.carintel.domain.vehicle.service.match.MatchCriteria;
import com.carintel.domain.vehicle.service.match.SpecMatchStrategy;
import com.carintel.domain.vehicle.service.match.VehicleDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 차량 식별 정보를 표준 제원으로 해석
 *
 * 등록된 매칭 전략을 순서대로 적용하고 첫 번째로 결과가 있는 전략을 채택.
 * 매칭 결과가 없는 것은 오류가 아님
 */
@Slf4j
@Component
public class VehicleSpecResolver {

    private final List<SpecMatchStrategy> strategies;
    private final VehicleSpecRepository vehicleSpecRepository;

    public VehicleSpecResolver(List<SpecMatchStrategy> strategies, VehicleSpecRepository vehicleSpecRepository) {
        this.strategies = List.copyOf(strategies);
        this.vehicleSpecRepository = vehicleSpecRepository;
    }

    /**
     * 표준 제원 조회
     */
    public Optional<VehicleSpec> resolve(VehicleDescriptor descriptor) {
        return firstPresent(descriptor, vehicleSpecRepository::findFirstByCriteria);
    }

    /**
     * 동일 전략 순서로 종속 데이터(시세, 정비) 조회
     */
    public <T> List<T> firstMatch(VehicleDescriptor descriptor, Function<MatchCriteria, List<T>> query) {
        return firstPresent(descriptor, criteria -> {
            List<T> rows = query.apply(criteria);
            return rows == null || rows.isEmpty() ? Optional.<List<T>>empty() : Optional.of(rows);
        }).orElse(Collections.emptyList());
    }

    private <T> Optional<T> firstPresent(VehicleDescriptor descriptor, Function<MatchCriteria, Optional<T>> query) {
        for (SpecMatchStrategy strategy : strategies) {
            Optional<MatchCriteria> criteria = strategy.criteriaFor(descriptor);
            if (criteria.isEmpty()) {
                continue;
            }

            Optional<T> result = query.apply(criteria.get());
            if (result.isPresent()) {
                log.debug("Matched {} {} {} using strategy {}",
                        descriptor.getYear(), descriptor.getMake(), descriptor.getModel(), strategy.name());
                return result;
            }
        }

        log.debug("No match for {} {} {} (trim={})",
                descriptor.getYear(), descriptor.getMake(), descriptor.getModel(), descriptor.getTrim());
        return Optional.empty();
    }
}
