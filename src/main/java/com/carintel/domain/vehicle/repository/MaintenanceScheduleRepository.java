package com.carintel.domain.vehicle.repository;

import com.carintel.domain.vehicle.entity.MaintenanceSchedule;
import com.carintel.domain.vehicle.service.match.MatchCriteria;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 정비 일정 Repository (vehicle_maintenance_schedules)
 */
@Mapper
public interface MaintenanceScheduleRepository {

    /**
     * 매칭 조건의 정비 일정 조회 (주행거리 오름차순)
     */
    List<MaintenanceSchedule> findByCriteria(@Param("criteria") MatchCriteria criteria);
}
