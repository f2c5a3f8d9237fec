package com.carintel.domain.vehicle.controller;

import com.carintel.common.dto.ApiResponse;
import com.carintel.common.util.ResponseUtils;
import com.carintel.domain.vehicle.dto.DecodedVin;
import com.carintel.domain.vehicle.dto.MarketCondition;
import com.carintel.domain.vehicle.dto.VehicleDto;
import com.carintel.domain.vehicle.entity.AutocompleteEntry;
import com.carintel.domain.vehicle.entity.MaintenanceSchedule;
import com.carintel.domain.vehicle.entity.VehicleSpec;
import com.carintel.domain.vehicle.entity.VehicleWarranty;
import com.carintel.domain.vehicle.service.VehicleCatalogService;
import com.carintel.domain.vehicle.service.VehicleLookupService;
import com.carintel.domain.vehicle.service.VehicleSearchService;
import com.carintel.domain.vehicle.service.VinDecoderService;
import com.carintel.domain.vehicle.service.match.VehicleDescriptor;
import com.carintel.domain.vehicle.validator.VehicleRequestValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 차량 정보 조회 컨트롤러
 */
@Slf4j
@RestController
@RequestMapping("/vehicles")
@RequiredArgsConstructor
@Tag(name = "Vehicles", description = "VIN 디코딩, 제원/보증/시세/정비 조회 및 자동완성 API")
public class VehicleController {

    private final VinDecoderService vinDecoderService;
    private final VehicleLookupService lookupService;
    private final VehicleCatalogService catalogService;
    private final VehicleSearchService searchService;
    private final VehicleRequestValidator validator;

    @Operation(summary = "VIN 전체 조회", description = "VIN을 디코딩하고 제원, 보증, 시세, 정비 정보를 함께 조회합니다.")
    @GetMapping("/vin/{vin}")
    public ResponseEntity<ApiResponse<VehicleDto.VinLookupResponse>> lookupByVin(
            @Parameter(description = "17자리 VIN") @PathVariable String vin) {

        return ResponseEntity.ok(ResponseUtils.success(lookupService.lookupByVin(vin)));
    }

    @Operation(summary = "VIN 디코딩", description = "VIN을 디코딩만 하고 DB 조회는 하지 않습니다.")
    @GetMapping("/decode/{vin}")
    public ResponseEntity<ApiResponse<DecodedVin>> decodeVin(
            @Parameter(description = "17자리 VIN") @PathVariable String vin) {

        return ResponseEntity.ok(ResponseUtils.success(vinDecoderService.decode(vin)));
    }

    @Operation(summary = "연식/제조사/모델 조회", description = "연식, 제조사, 모델(트림 선택)로 차량 정보를 조회합니다.")
    @GetMapping("/lookup")
    public ResponseEntity<ApiResponse<VehicleDto.LookupResponse>> lookup(
            @Parameter(description = "연식") @RequestParam(required = false) String year,
            @Parameter(description = "제조사") @RequestParam(required = false) String make,
            @Parameter(description = "모델") @RequestParam(required = false) String model,
            @Parameter(description = "트림") @RequestParam(required = false) String trim) {

        VehicleDescriptor descriptor = VehicleDescriptor.builder()
                .year(validator.requireYear(year))
                .make(validator.requireText("make", make))
                .model(validator.requireText("model", model))
                .trim(validator.optionalText(trim))
                .build();

        return ResponseEntity.ok(ResponseUtils.success(lookupService.lookup(descriptor)));
    }

    @Operation(summary = "제원 검색", description = "연식/제조사/모델/트림 일치 조건으로 제원 목록을 조회합니다.")
    @GetMapping("/specs")
    public ResponseEntity<ApiResponse<List<VehicleSpec>>> searchSpecs(
            @RequestParam(required = false) String year,
            @RequestParam(required = false) String make,
            @RequestParam(required = false) String model,
            @RequestParam(required = false) String trim,
            @Parameter(description = "최대 조회 수 (기본 50, 최대 100)") @RequestParam(required = false) String limit) {

        VehicleDto.SpecSearchRequest request = VehicleDto.SpecSearchRequest.builder()
                .year(validator.optionalYear(year))
                .make(validator.optionalText(make))
                .model(validator.optionalText(model))
                .trim(validator.optionalText(trim))
                .limit(validator.limit(limit, VehicleLookupService.DEFAULT_SPEC_LIMIT, VehicleLookupService.MAX_SPEC_LIMIT))
                .build();

        return ResponseEntity.ok(ResponseUtils.success(lookupService.searchSpecs(request)));
    }

    @Operation(summary = "연식 목록", description = "등록된 연식 목록을 최신순으로 조회합니다.")
    @GetMapping("/years")
    public ResponseEntity<ApiResponse<List<Integer>>> getYears() {
        return ResponseEntity.ok(ResponseUtils.success(catalogService.getYears()));
    }

    @Operation(summary = "차량 자동완성 검색", description = "\"2020 honda civic\" 형태의 검색어로 차량을 찾습니다.")
    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<AutocompleteEntry>>> search(
            @Parameter(description = "검색어 (2자 이상)") @RequestParam(required = false) String q,
            @Parameter(description = "q의 별칭") @RequestParam(required = false) String query,
            @Parameter(description = "최대 결과 수 (기본 20, 최대 50)") @RequestParam(required = false) String limit) {

        String text = validator.searchQuery(q != null ? q : query);
        int max = validator.limit(limit, VehicleSearchService.DEFAULT_LIMIT, VehicleSearchService.MAX_LIMIT);

        return ResponseEntity.ok(ResponseUtils.success(searchService.search(text, max)));
    }

    @Operation(summary = "제원 조회", description = "제원 ID로 차량 제원을 조회합니다.")
    @GetMapping("/{id}/specs")
    public ResponseEntity<ApiResponse<VehicleSpec>> getSpec(
            @Parameter(description = "제원 ID (UUID)") @PathVariable String id) {

        UUID specId = validator.parseSpecId(id);
        return ResponseEntity.ok(ResponseUtils.success(lookupService.getSpec(specId)));
    }

    @Operation(summary = "보증 조회", description = "제원 ID로 보증 정보를 조회합니다.")
    @GetMapping("/{id}/warranty")
    public ResponseEntity<ApiResponse<List<VehicleWarranty>>> getWarranty(@PathVariable String id) {
        UUID specId = validator.parseSpecId(id);
        return ResponseEntity.ok(ResponseUtils.success(lookupService.getWarranty(specId)));
    }

    @Operation(summary = "시세 조회", description = "상태별 시세를 조회하고, 주행거리가 주어지면 보정합니다.")
    @GetMapping("/{id}/market-value")
    public ResponseEntity<ApiResponse<Map<String, VehicleDto.MarketValueSet>>> getMarketValue(
            @PathVariable String id,
            @Parameter(description = "Outstanding, Clean, Average, Rough") @RequestParam(required = false) String condition,
            @Parameter(description = "현재 주행거리 (마일)") @RequestParam(required = false) String mileage) {

        UUID specId = validator.parseSpecId(id);
        MarketCondition marketCondition = validator.optionalCondition(condition);
        Integer miles = validator.optionalNonNegative("mileage", mileage);

        return ResponseEntity.ok(ResponseUtils.success(lookupService.getMarketValue(specId, marketCondition, miles)));
    }

    @Operation(summary = "정비 일정 조회", description = "현재 주행거리 이후의 정비 일정을 조회합니다.")
    @GetMapping("/{id}/maintenance")
    public ResponseEntity<ApiResponse<List<MaintenanceSchedule>>> getMaintenance(
            @PathVariable String id,
            @Parameter(description = "현재 주행거리 (마일)") @RequestParam(name = "current_mileage", required = false) String currentMileage) {

        UUID specId = validator.parseSpecId(id);
        Integer mileage = validator.optionalNonNegative("current_mileage", currentMileage);

        return ResponseEntity.ok(ResponseUtils.success(lookupService.getMaintenance(specId, mileage)));
    }
}
