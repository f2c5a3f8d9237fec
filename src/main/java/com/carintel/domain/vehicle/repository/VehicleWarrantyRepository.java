package com.carintel.domain.vehicle.repository;

import com.carintel.domain.vehicle.entity.VehicleWarranty;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.UUID;

/**
 * 차량 보증 Repository (vehicle_warranties)
 */
@Mapper
public interface VehicleWarrantyRepository {

    /**
     * 제원 ID로 보증 목록 조회
     */
    List<VehicleWarranty> findBySpecId(@Param("vehicleSpecId") UUID vehicleSpecId);
}
