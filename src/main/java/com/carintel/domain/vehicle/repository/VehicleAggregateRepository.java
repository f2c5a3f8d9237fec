package com.carintel.domain.vehicle.repository;

import com.carintel.domain.vehicle.entity.AutocompleteEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 사전 집계 뷰 Repository (vehicle_years, vehicle_makes, vehicle_models, vehicle_autocomplete)
 *
 * 뷰가 없는 환경에서는 관계 부재 오류(42P01)가 발생하며, 호출 측에서 vehicle_specs 조회로 대체
 */
@Mapper
public interface VehicleAggregateRepository {

    List<Integer> findYears();

    List<String> findMakes(@Param("year") Integer year);

    List<String> findModels(@Param("year") Integer year, @Param("make") String make);

    List<AutocompleteEntry> searchAutocomplete(@Param("year") Integer year,
                                               @Param("tokens") List<String> tokens,
                                               @Param("limit") int limit);
}
