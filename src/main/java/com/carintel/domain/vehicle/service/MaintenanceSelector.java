package com.carintel.domain.vehicle.service;

import com.carintel.domain.vehicle.entity.MaintenanceSchedule;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 정비 일정 선택 (현재 주행거리 이후 항목, 주행거리 오름차순, 최대 50건)
 */
@Component
public class MaintenanceSelector {

    static final int MAX_ITEMS = 50;

    public List<MaintenanceSchedule> select(List<MaintenanceSchedule> items, Integer currentMileage) {
        return items.stream()
                .filter(item -> currentMileage == null
                        || (item.getMileage() != null && item.getMileage() >= currentMileage))
                .sorted(Comparator.comparing(MaintenanceSchedule::getMileage,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(MAX_ITEMS)
                .collect(Collectors.toList());
    }
}
