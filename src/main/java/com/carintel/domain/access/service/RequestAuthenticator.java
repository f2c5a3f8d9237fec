package com.carintel.domain.access.service;

import com.carintel.domain.access.dto.ApiKeyPrincipal;
import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청 인증
 */
public interface RequestAuthenticator {

    /**
     * 요청의 자격 증명 검증
     *
     * @throws com.carintel.common.exception.BusinessException 인증 실패(unauthorized) 또는 사용량 초과(quota_exceeded)
     */
    ApiKeyPrincipal authenticate(HttpServletRequest request);
}
