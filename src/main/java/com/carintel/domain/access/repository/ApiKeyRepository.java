package com.carintel.domain.access.repository;

import com.carintel.domain.access.dto.ApiKeyValidation;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

/**
 * API 키 검증 Repository
 */
@Mapper
public interface ApiKeyRepository {

    /**
     * 키 해시(SHA-256 hex)로 키/조직/구독 상태 검증
     */
    Optional<ApiKeyValidation> validateKey(@Param("keyHash") String keyHash);
}
