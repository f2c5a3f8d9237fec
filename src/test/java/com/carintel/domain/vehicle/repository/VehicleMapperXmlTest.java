package com.carintel.domain.vehicle.repository;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 매퍼 XML의 ILIKE 패턴 검색은 모두 백슬래시 이스케이프를 명시해야 함
 * (MatchPatterns.escapeLike로 만든 패턴과 짝을 이룸)
 */
class VehicleMapperXmlTest {

    private static final Pattern ILIKE = Pattern.compile("\\bILIKE\\b");
    private static final Pattern ESCAPED_ILIKE = Pattern.compile("\\bILIKE\\b[^\\n]*?ESCAPE '\\\\'");

    @ParameterizedTest
    @ValueSource(strings = {
        "VehicleSpecMapper.xml",
        "VehicleAggregateMapper.xml",
        "VehicleMarketValueMapper.xml",
        "MaintenanceScheduleMapper.xml"
    })
    void shouldDeclareEscapeCharacterForEveryIlike(String mapper) throws IOException {
        // Given
        String xml = StreamUtils.copyToString(
                new ClassPathResource("mybatis/mapper/vehicle/" + mapper).getInputStream(), StandardCharsets.UTF_8);

        // When
        int ilikeCount = count(ILIKE.matcher(xml));
        int escapedCount = count(ESCAPED_ILIKE.matcher(xml));

        // Then
        assertTrue(ilikeCount > 0, mapper + " has no ILIKE clause");
        assertEquals(ilikeCount, escapedCount, mapper + " has ILIKE without ESCAPE");
    }

    private static int count(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
