package com.carintel.domain.vehicle.repository;

import com.carintel.domain.vehicle.dto.VehicleDto;
import com.carintel.domain.vehicle.entity.AutocompleteEntry;
import com.carintel.domain.vehicle.entity.VehicleSpec;
import com.carintel.domain.vehicle.service.match.MatchCriteria;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 차량 제원 Repository (vehicle_specs)
 */
@Mapper
public interface VehicleSpecRepository {

    /**
     * 제원 조회 (ID)
     */
    Optional<VehicleSpec> findById(@Param("id") UUID id);

    /**
     * 매칭 조건의 첫 번째 제원 조회 (trim 오름차순, id 오름차순)
     */
    Optional<VehicleSpec> findFirstByCriteria(@Param("criteria") MatchCriteria criteria);

    /**
     * 원시 제원 검색
     */
    List<VehicleSpec> search(@Param("condition") VehicleDto.SpecSearchRequest condition);

    /**
     * 연식 목록 (vehicle_specs DISTINCT 조회)
     */
    List<Integer> findYears();

    /**
     * 제조사 목록 (vehicle_specs DISTINCT 조회)
     */
    List<String> findMakes(@Param("year") Integer year);

    List<String> findModels(@Param("year") Integer year, @Param("make") String make);

    List<String> findTrims(@Param("year") Integer year,
                           @Param("make") String make,
                           @Param("model") String model);

    /**
     * 자동완성 대체 조회 (토큰별 제조사/모델 ILIKE)
     */
    List<AutocompleteEntry> searchAutocomplete(@Param("year") Integer year,
                                               @Param("tokens") List<String> tokens,
                                               @Param("limit") int limit);
}
