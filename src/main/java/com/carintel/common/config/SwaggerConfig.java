package com.carintel.common.config;

import com.carintel.domain.access.service.ApiKeyAuthService;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 문서 설정 (API 키 헤더 인증)
 */
@Configuration
public class SwaggerConfig {

    private static final String API_KEY_SCHEME = "apiKey";

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Bean
    public OpenAPI carIntelOpenApi() {
        SecurityScheme apiKey = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(ApiKeyAuthService.API_KEY_HEADER)
                .description("발급받은 API 키 (Authorization: Bearer 도 허용)");

        return new OpenAPI()
                .info(new Info()
                        .title("Car Intel Vehicle API")
                        .description("VIN 디코딩, 차량 제원/보증/시세/정비 조회 및 자동완성 API")
                        .version(appVersion))
                .components(new Components().addSecuritySchemes(API_KEY_SCHEME, apiKey))
                .addSecurityItem(new SecurityRequirement().addList(API_KEY_SCHEME));
    }
}
