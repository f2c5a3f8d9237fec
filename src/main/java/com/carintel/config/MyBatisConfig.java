package com.carintel.config;

import com.carintel.common.config.UuidTypeHandler;
import org.apache.ibatis.annotations.Mapper;
import org.mybatis.spring.annotation.MapperScan;
import org.mybatis.spring.boot.autoconfigure.ConfigurationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * MyBatis 설정
 *
 * SqlSessionFactory는 자동 구성을 사용하고 (매퍼 XML 위치, 타입 별칭은 application.yml),
 * 여기서는 세션 공통 옵션과 UUID 핸들러만 지정
 */
@Configuration
@MapperScan(basePackages = "com.carintel.domain", annotationClass = Mapper.class)
public class MyBatisConfig {

    @Bean
    public ConfigurationCustomizer vehicleMyBatisCustomizer() {
        return configuration -> {
            configuration.setMapUnderscoreToCamelCase(true);
            // 2차 캐시 미사용 (Redis 캐시 계층 사용)
            configuration.setCacheEnabled(false);
            configuration.setDefaultStatementTimeout(10);
            configuration.getTypeHandlerRegistry().register(UUID.class, new UuidTypeHandler());
        };
    }
}
