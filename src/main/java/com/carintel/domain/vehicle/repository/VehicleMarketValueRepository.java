package com.carintel.domain.vehicle.repository;

import com.carintel.domain.vehicle.entity.VehicleMarketValue;
import com.carintel.domain.vehicle.service.match.MatchCriteria;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 차량 시세 Repository (vehicle_market_values)
 */
@Mapper
public interface VehicleMarketValueRepository {

    /**
     * 매칭 조건의 시세 행 조회 (condition 지정 시 해당 상태만)
     */
    List<VehicleMarketValue> findByCriteria(@Param("criteria") MatchCriteria criteria,
                                            @Param("condition") String condition);
}
