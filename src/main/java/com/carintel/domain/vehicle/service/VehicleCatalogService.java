package com.carintel.domain.vehicle.service;

import com.carintel.common.util.SqlStateUtils;
import com.carintel.domain.vehicle.repository.VehicleAggregateRepository;
import com.carintel.domain.vehicle.repository.VehicleSpecRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 연식/제조사/모델/트림 목록 서비스
 *
 * 사전 집계 뷰를 우선 사용하고, 뷰가 없으면 vehicle_specs에서 직접 조회.
 * 결과는 Redis 캐시에 저장 (키의 연식 미지정은 "all", 제조사/모델은 소문자)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VehicleCatalogService {

    private final VehicleAggregateRepository aggregateRepository;
    private final VehicleSpecRepository vehicleSpecRepository;

    /**
     * 연식 목록 (내림차순, 캐시 적용)
     */
    @Cacheable(value = CacheResource.YEARS, key = "'all'")
    public List<Integer> getYears() {
        log.info("Fetching vehicle years");

        return descending(withAggregateFallback("vehicle_years",
                aggregateRepository::findYears,
                vehicleSpecRepository::findYears));
    }

    /**
     * 제조사 목록 (오름차순, 캐시 적용)
     */
    @Cacheable(value = CacheResource.MAKES, key = "#year == null ? 'all' : #year")
    public List<String> getMakes(Integer year) {
        log.info("Fetching vehicle makes: year={}", year);

        return ascending(withAggregateFallback("vehicle_makes",
                () -> aggregateRepository.findMakes(year),
                () -> vehicleSpecRepository.findMakes(year)));
    }

    /**
     * 제조사별 모델 목록 (오름차순, 캐시 적용)
     */
    @Cacheable(value = CacheResource.MODELS,
            key = "(#year == null ? 'all' : #year) + ':' + #make.toLowerCase(T(java.util.Locale).ROOT)")
    public List<String> getModels(Integer year, String make) {
        log.info("Fetching vehicle models: year={}, make={}", year, make);

        return ascending(withAggregateFallback("vehicle_models",
                () -> aggregateRepository.findModels(year, make),
                () -> vehicleSpecRepository.findModels(year, make)));
    }

    /**
     * 모델별 트림 목록 (null 제외, 오름차순, 캐시 적용)
     */
    @Cacheable(value = CacheResource.TRIMS,
            key = "(#year == null ? 'all' : #year) + ':' + #make.toLowerCase(T(java.util.Locale).ROOT)"
                    + " + ':' + #model.toLowerCase(T(java.util.Locale).ROOT)")
    public List<String> getTrims(Integer year, String make, String model) {
        log.info("Fetching vehicle trims: year={}, make={}, model={}", year, make, model);

        return ascending(vehicleSpecRepository.findTrims(year, make, model));
    }

    /**
     * 집계 뷰 조회, 관계 부재(42P01)일 때만 대체 조회
     */
    <T> List<T> withAggregateFallback(String view, Supplier<List<T>> aggregate, Supplier<List<T>> fallback) {
        try {
            return aggregate.get();
        } catch (DataAccessException e) {
            if (!SqlStateUtils.isMissingRelation(e)) {
                throw e;
            }
            log.warn("Aggregate view {} unavailable, falling back to vehicle_specs", view);
            return fallback.get();
        }
    }

    private static List<Integer> descending(Collection<Integer> years) {
        return years.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
    }

    private static List<String> ascending(Collection<String> values) {
        TreeSet<String> sorted = values.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        return new ArrayList<>(sorted);
    }
}
