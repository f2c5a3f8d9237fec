package com.carintel.domain.vehicle.service;

import com.carintel.domain.vehicle.client.NhtsaVpicClient;
import com.carintel.domain.vehicle.dto.DecodedVin;
import com.carintel.domain.vehicle.dto.NhtsaDto;
import com.carintel.domain.vehicle.exception.VinDecodeException;
import com.carintel.domain.vehicle.validator.VehicleRequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VIN 디코딩 서비스
 *
 * vPIC의 Variable/Value 목록을 DecodedVin 구조로 변환
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VinDecoderService {

    private static final String SUCCESS_ERROR_CODE = "0";

    // 선행 정수 ("4.0" -> 4, "-3" -> -3)
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private final NhtsaVpicClient nhtsaVpicClient;
    private final VehicleRequestValidator validator;

    /**
     * VIN 디코딩
     */
    public DecodedVin decode(String rawVin) {
        String vin = validator.normalizeVin(rawVin);

        NhtsaDto.DecodeResponse response;
        try {
            response = nhtsaVpicClient.decodeVin(vin);
        } catch (ResourceAccessException e) {
            throw VinDecodeException.upstreamUnavailable("vPIC unreachable after retry", e);
        }

        DecodedVin decoded = toDecodedVin(vin, response.getResults());

        // 에러 코드 "0" 이외는 데이터를 유지한 채 경고만 추가
        if (decoded.getErrorCode() != null && !SUCCESS_ERROR_CODE.equals(decoded.getErrorCode())) {
            log.info("vPIC returned warning for VIN {}: [{}] {}", vin, decoded.getErrorCode(), decoded.getErrorText());
            return decoded.toBuilder()
                    .warning(decoded.getErrorText())
                    .build();
        }

        return decoded;
    }

    /**
     * 디코딩 후 연식/제조사/모델이 모두 있는지 확인 (VIN 전체 조회용)
     */
    public DecodedVin decodeWithIdentity(String rawVin) {
        DecodedVin decoded = decode(rawVin);
        if (!decoded.hasVehicleIdentity()) {
            log.warn("VIN decoded without vehicle identity: vin={}", decoded.getVin());
            throw VinDecodeException.decodeFailed("Could not decode vehicle information from VIN");
        }
        return decoded;
    }

    DecodedVin toDecodedVin(String vin, List<NhtsaDto.Result> results) {
        Map<String, String> values = new HashMap<>();
        for (NhtsaDto.Result result : results) {
            if (result.getVariable() != null) {
                // 동일 변수가 여러 번 나오면 첫 값 사용
                values.putIfAbsent(result.getVariable(), blankToNull(result.getValue()));
            }
        }

        return DecodedVin.builder()
                .vin(vin)
                .year(parseLeadingInt(values.get("Model Year")))
                .make(values.get("Make"))
                .model(values.get("Model"))
                .trim(values.get("Trim"))
                .bodyType(values.get("Body Class"))
                .vehicleType(values.get("Vehicle Type"))
                .doors(parseLeadingInt(values.get("Doors")))
                .engine(DecodedVin.Engine.builder()
                        .cylinders(parseLeadingInt(values.get("Engine Number of Cylinders")))
                        .displacement(values.get("Displacement (L)"))
                        .horsepower(parseLeadingInt(values.get("Engine Brake (hp) From")))
                        .fuelType(values.get("Fuel Type - Primary"))
                        .build())
                .drivetrain(values.get("Drive Type"))
                .transmission(values.get("Transmission Style"))
                .manufacturer(values.get("Manufacturer Name"))
                .plantCountry(values.get("Plant Country"))
                .plantCity(values.get("Plant City"))
                .errorCode(values.get("Error Code"))
                .errorText(values.get("Error Text"))
                .build();
    }

    static Integer parseLeadingInt(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = LEADING_INTEGER.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            // int 범위 초과
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }
}
