package com.carintel.domain.usage.repository;

import com.carintel.domain.usage.entity.UsageRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 사용 로그 Repository
 */
@Mapper
public interface UsageLogRepository {

    /**
     * 사용 로그 일괄 저장
     */
    int insertBatch(@Param("records") List<UsageRecord> records);
}
