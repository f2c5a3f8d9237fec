package com.carintel.domain.vehicle.client;

import com.carintel.domain.vehicle.dto.NhtsaDto;
import com.carintel.domain.vehicle.exception.VinDecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * NHTSA vPIC VIN 디코더 API 클라이언트
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NhtsaVpicClient {

    private final NhtsaVpicConfig config;
    private final RestTemplate restTemplate;

    /**
     * VIN 디코딩
     *
     * 연결 실패/타임아웃(ResourceAccessException)은 1회 재시도 후 그대로 전달되며,
     * 그 외 오류는 VinDecodeException으로 변환
     */
    @Retryable(
        retryFor = {ResourceAccessException.class},
        maxAttempts = 2,
        backoff = @Backoff(delay = 200)
    )
    public NhtsaDto.DecodeResponse decodeVin(String vin) {
        log.info("Decoding VIN via vPIC: vin={}", vin);

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/vehicles/decodevin/{vin}")
                .queryParam("format", "json")
                .buildAndExpand(vin)
                .toUri();

        NhtsaDto.DecodeResponse response;
        try {
            response = restTemplate.getForObject(uri, NhtsaDto.DecodeResponse.class);

        } catch (ResourceAccessException e) {
            log.warn("vPIC request failed (transport): vin={}, cause={}", vin, e.getMessage());
            throw e;
        } catch (HttpClientErrorException e) {
            log.warn("vPIC rejected VIN: vin={}, status={}", vin, e.getStatusCode());
            throw VinDecodeException.decodeFailed("Could not decode vehicle information from VIN", e);
        } catch (HttpServerErrorException e) {
            log.error("vPIC server error: vin={}, status={}", vin, e.getStatusCode());
            throw VinDecodeException.upstreamUnavailable("vPIC returned " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            // 응답 본문 파싱 실패 등
            log.error("Unexpected vPIC response: vin={}", vin, e);
            throw VinDecodeException.upstreamUnavailable("Unreadable vPIC response", e);
        }

        if (response == null || response.getResults() == null) {
            throw VinDecodeException.upstreamUnavailable("Empty vPIC response", null);
        }

        log.debug("vPIC decode completed: vin={}, variables={}", vin, response.getResults().size());
        return response;
    }
}
