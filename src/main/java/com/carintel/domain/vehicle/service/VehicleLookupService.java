package com.carintel.domain.vehicle.service;

import com.carintel.domain.vehicle.dto.DecodedVin;
import com.carintel.domain.vehicle.dto.MarketCondition;
import com.carintel.domain.vehicle.dto.VehicleDto;
import com.carintel.domain.vehicle.entity.MaintenanceSchedule;
import com.carintel.domain.vehicle.entity.VehicleSpec;
import com.carintel.domain.vehicle.entity.VehicleWarranty;
import com.carintel.domain.vehicle.exception.VehicleNotFoundException;
import com.carintel.domain.vehicle.repository.MaintenanceScheduleRepository;
import com.carintel.domain.vehicle.repository.VehicleMarketValueRepository;
import com.carintel.domain.vehicle.repository.VehicleSpecRepository;
import com.carintel.domain.vehicle.repository.VehicleWarrantyRepository;
import com.carintel.domain.vehicle.service.match.MatchCriteria;
import com.carintel.domain.vehicle.service.match.MatchPatterns;
import com.carintel.domain.vehicle.service.match.VehicleDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 차량 조회 서비스
 *
 * VIN 또는 연식/제조사/모델/트림으로 제원을 해석하고 보증, 시세, 정비 정보를 결합
 */
@Slf4j
@Service
public class VehicleLookupService {

    public static final int DEFAULT_SPEC_LIMIT = 50;
    public static final int MAX_SPEC_LIMIT = 100;

    private final VinDecoderService vinDecoderService;
    private final VehicleSpecResolver specResolver;
    private final VehicleSpecRepository vehicleSpecRepository;
    private final VehicleWarrantyRepository warrantyRepository;
    private final VehicleMarketValueRepository marketValueRepository;
    private final MaintenanceScheduleRepository maintenanceRepository;
    private final MarketValueFormatter marketValueFormatter;
    private final MaintenanceSelector maintenanceSelector;
    private final Executor lookupExecutor;

    public VehicleLookupService(VinDecoderService vinDecoderService,
                                VehicleSpecResolver specResolver,
                                VehicleSpecRepository vehicleSpecRepository,
                                VehicleWarrantyRepository warrantyRepository,
                                VehicleMarketValueRepository marketValueRepository,
                                MaintenanceScheduleRepository maintenanceRepository,
                                MarketValueFormatter marketValueFormatter,
                                MaintenanceSelector maintenanceSelector,
                                @Qualifier("vehicleLookupExecutor") Executor lookupExecutor) {
        this.vinDecoderService = vinDecoderService;
        this.specResolver = specResolver;
        this.vehicleSpecRepository = vehicleSpecRepository;
        this.warrantyRepository = warrantyRepository;
        this.marketValueRepository = marketValueRepository;
        this.maintenanceRepository = maintenanceRepository;
        this.marketValueFormatter = marketValueFormatter;
        this.maintenanceSelector = maintenanceSelector;
        this.lookupExecutor = lookupExecutor;
    }

    /**
     * VIN 전체 조회 (디코딩 + 제원 + 보증/시세/정비)
     */
    public VehicleDto.VinLookupResponse lookupByVin(String vin) {
        DecodedVin decoded = vinDecoderService.decodeWithIdentity(vin);
        log.info("VIN lookup: vin={}, vehicle={} {} {}",
                decoded.getVin(), decoded.getYear(), decoded.getMake(), decoded.getModel());

        VehicleDescriptor descriptor = VehicleDescriptor.builder()
                .year(decoded.getYear())
                .make(decoded.getMake())
                .model(decoded.getModel())
                .trim(decoded.getTrim())
                .build();

        Enrichment enrichment = enrich(descriptor);

        return VehicleDto.VinLookupResponse.builder()
                .vinInfo(decoded)
                .specs(enrichment.spec)
                .warranty(enrichment.warranty)
                .marketValues(enrichment.marketValues)
                .maintenance(enrichment.maintenance)
                .build();
    }

    /**
     * 연식/제조사/모델/트림 조회
     *
     * 제원, 보증, 시세, 정비가 모두 없으면 404
     */
    public VehicleDto.LookupResponse lookup(VehicleDescriptor descriptor) {
        log.info("Vehicle lookup: {} {} {} trim={}",
                descriptor.getYear(), descriptor.getMake(), descriptor.getModel(), descriptor.getTrim());

        Enrichment enrichment = enrich(descriptor);

        VehicleDto.LookupResponse response = VehicleDto.LookupResponse.builder()
                .specs(enrichment.spec)
                .warranty(enrichment.warranty)
                .marketValues(enrichment.marketValues)
                .maintenance(enrichment.maintenance)
                .build();

        if (response.isEmpty()) {
            throw new VehicleNotFoundException("No data found for this vehicle");
        }
        return response;
    }

    /**
     * 제원 조회 (ID)
     */
    public VehicleSpec getSpec(UUID id) {
        log.info("Fetching vehicle spec: id={}", id);
        return vehicleSpecRepository.findById(id)
                .orElseThrow(VehicleNotFoundException::new);
    }

    /**
     * 보증 목록 조회 (제원이 없으면 404, 보증이 없으면 빈 목록)
     */
    public List<VehicleWarranty> getWarranty(UUID id) {
        getSpec(id);
        return warrantyRepository.findBySpecId(id);
    }

    /**
     * 제원 기준 시세 조회 (모델/트림 대소문자 무시 일치)
     */
    public Map<String, VehicleDto.MarketValueSet> getMarketValue(UUID id, MarketCondition condition, Integer mileage) {
        VehicleSpec spec = getSpec(id);

        MatchCriteria criteria = MatchCriteria.builder()
                .year(spec.getYear())
                .make(spec.getMake())
                .modelPattern(MatchPatterns.escapeLike(spec.getModel()))
                .trimPattern(MatchPatterns.escapeLike(spec.getTrim()))
                .build();

        String conditionLabel = condition == null ? null : condition.getLabel();
        Map<String, VehicleDto.MarketValueSet> values =
                marketValueFormatter.format(marketValueRepository.findByCriteria(criteria, conditionLabel));

        if (mileage != null && spec.getYear() != null) {
            values = marketValueFormatter.adjustForMileage(values, spec.getYear(), mileage);
        }
        return values;
    }

    /**
     * 제원 기준 정비 일정 조회 (트림 접두어 일치)
     */
    public List<MaintenanceSchedule> getMaintenance(UUID id, Integer currentMileage) {
        VehicleSpec spec = getSpec(id);

        MatchCriteria criteria = MatchCriteria.builder()
                .year(spec.getYear())
                .make(spec.getMake())
                .modelPattern(MatchPatterns.escapeLike(spec.getModel()))
                .trimPattern(spec.getTrim() == null ? null : MatchPatterns.escapeLike(spec.getTrim()) + "%")
                .build();

        return maintenanceSelector.select(maintenanceRepository.findByCriteria(criteria), currentMileage);
    }

    /**
     * 원시 제원 검색
     */
    public List<VehicleSpec> searchSpecs(VehicleDto.SpecSearchRequest request) {
        log.info("Searching vehicle specs: {}", request);
        return vehicleSpecRepository.search(request);
    }

    /**
     * 제원 해석 후 보증/시세/정비를 병렬 조회
     */
    private Enrichment enrich(VehicleDescriptor descriptor) {
        Optional<VehicleSpec> spec = specResolver.resolve(descriptor);

        CompletableFuture<List<VehicleWarranty>> warranty = spec
                .map(found -> async("warranty", () -> warrantyRepository.findBySpecId(found.getId()),
                        Collections.<VehicleWarranty>emptyList()))
                .orElseGet(() -> CompletableFuture.completedFuture(Collections.emptyList()));

        CompletableFuture<Map<String, VehicleDto.MarketValueSet>> marketValues = async("market-values",
                () -> marketValueFormatter.format(specResolver.firstMatch(descriptor,
                        criteria -> marketValueRepository.findByCriteria(criteria, null))),
                Collections.<String, VehicleDto.MarketValueSet>emptyMap());

        CompletableFuture<List<MaintenanceSchedule>> maintenance = async("maintenance",
                () -> maintenanceSelector.select(
                        specResolver.firstMatch(descriptor, maintenanceRepository::findByCriteria), null),
                Collections.<MaintenanceSchedule>emptyList());

        CompletableFuture.allOf(warranty, marketValues, maintenance).join();

        return new Enrichment(spec.orElse(null), warranty.join(), marketValues.join(), maintenance.join());
    }

    /**
     * 개별 조회 실패는 로그 후 기본값으로 대체
     */
    private <T> CompletableFuture<T> async(String name, Supplier<T> supplier, T fallback) {
        try {
            return CompletableFuture.supplyAsync(supplier, lookupExecutor)
                    .exceptionally(ex -> {
                        log.warn("Sub-lookup {} failed, using empty result", name, ex);
                        return fallback;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Sub-lookup {} rejected by executor, using empty result", name);
            return CompletableFuture.completedFuture(fallback);
        }
    }

    private static class Enrichment {
        private final VehicleSpec spec;
        private final List<VehicleWarranty> warranty;
        private final Map<String, VehicleDto.MarketValueSet> marketValues;
        private final List<MaintenanceSchedule> maintenance;

        private Enrichment(VehicleSpec spec,
                           List<VehicleWarranty> warranty,
                           Map<String, VehicleDto.MarketValueSet> marketValues,
                           List<MaintenanceSchedule> maintenance) {
            this.spec = spec;
            this.warranty = warranty;
            this.marketValues = marketValues;
            this.maintenance = maintenance;
        }
    }
}
