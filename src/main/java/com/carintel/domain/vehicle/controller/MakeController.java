package com.carintel.domain.vehicle.controller;

import com.carintel.common.dto.ApiResponse;
import com.carintel.common.util.ResponseUtils;
import com.carintel.domain.vehicle.service.VehicleCatalogService;
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

/**
 * 제조사/모델/트림 목록 컨트롤러 (/makes, /vehicles/makes 모두 지원)
 */
@Slf4j
@RestController
@RequestMapping({"/makes", "/vehicles/makes"})
@RequiredArgsConstructor
@Tag(name = "Makes", description = "제조사, 모델, 트림 목록 API")
public class MakeController {

    private final VehicleCatalogService catalogService;
    private final VehicleRequestValidator validator;

    @Operation(summary = "제조사 목록", description = "제조사 목록을 조회합니다. 연식을 지정하면 해당 연식만 조회합니다.")
    @GetMapping
    public ResponseEntity<ApiResponse<List<String>>> getMakes(
            @Parameter(description = "연식") @RequestParam(required = false) String year) {

        return ResponseEntity.ok(ResponseUtils.success(catalogService.getMakes(validator.optionalYear(year))));
    }

    @Operation(summary = "모델 목록", description = "제조사별 모델 목록을 조회합니다.")
    @GetMapping("/{make}/models")
    public ResponseEntity<ApiResponse<List<String>>> getModels(
            @Parameter(description = "제조사") @PathVariable String make,
            @Parameter(description = "연식") @RequestParam(required = false) String year) {

        return ResponseEntity.ok(ResponseUtils.success(
                catalogService.getModels(validator.optionalYear(year), make)));
    }

    @Operation(summary = "트림 목록", description = "모델별 트림 목록을 조회합니다.")
    @GetMapping("/{make}/models/{model}/trims")
    public ResponseEntity<ApiResponse<List<String>>> getTrims(
            @PathVariable String make,
            @PathVariable String model,
            @Parameter(description = "연식") @RequestParam(required = false) String year) {

        return ResponseEntity.ok(ResponseUtils.success(
                catalogService.getTrims(validator.optionalYear(year), make, model)));
    }
}
