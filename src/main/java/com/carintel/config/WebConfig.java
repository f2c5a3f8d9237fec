package com.carintel.config;

import com.carintel.domain.vehicle.client.NhtsaVpicConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.filter.ForwardedHeaderFilter;

import java.time.Clock;

/**
 * 웹 설정
 */
@Configuration
@EnableRetry
@EnableScheduling
public class WebConfig {

    /**
     * ForwardedHeaderFilter 등록
     * 프록시 환경에서 X-Forwarded-* 헤더를 통해 원본 요청 정보를 복원
     */
    @Bean
    public FilterRegistrationBean<ForwardedHeaderFilter> forwardedHeaderFilter() {
        FilterRegistrationBean<ForwardedHeaderFilter> bean = new FilterRegistrationBean<>();
        bean.setFilter(new ForwardedHeaderFilter());
        bean.setOrder(0); // 가장 먼저 실행
        bean.addUrlPatterns("/*");
        return bean;
    }

    /**
     * VIN 디코더 호출용 RestTemplate (연결/응답 타임아웃 적용)
     */
    @Bean
    public RestTemplate restTemplate(NhtsaVpicConfig nhtsaVpicConfig) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(nhtsaVpicConfig.getConnectTimeoutMs()))
                .setSocketTimeout(Timeout.ofMilliseconds(nhtsaVpicConfig.getReadTimeoutMs()))
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(nhtsaVpicConfig.getReadTimeoutMs()))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .build())
                .setDefaultRequestConfig(requestConfig)
                .build();

        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    /**
     * 보증/시세/정비 병렬 조회용 스레드풀
     */
    @Bean(name = "vehicleLookupExecutor")
    public ThreadPoolTaskExecutor vehicleLookupExecutor(VehicleApiProperties properties) {
        VehicleApiProperties.Lookup lookup = properties.getLookup();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(lookup.getCorePoolSize());
        executor.setMaxPoolSize(lookup.getMaxPoolSize());
        executor.setQueueCapacity(lookup.getQueueCapacity());
        executor.setThreadNamePrefix("vehicle-lookup-");
        executor.initialize();
        return executor;
    }

    /**
     * 시세 보정 기준 연도 계산용 시계
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
