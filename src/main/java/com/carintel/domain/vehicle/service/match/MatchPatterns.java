package com.carintel.domain.vehicle.service.match;

import java.util.regex.Pattern;

/**
 * 모델명/트림 정규화 및 ILIKE 패턴 생성 유틸리티
 */
public final class MatchPatterns {

    // 하이픈/공백 구간은 와일드카드로 취급 ("CR-V" ~ "CR V" ~ "CRV")
    private static final Pattern MODEL_SEPARATOR = Pattern.compile("[\\s-]+");

    private static final String TRIM_DELIMITER = "/";

    private MatchPatterns() {
    }

    /**
     * LIKE 메타문자(\, %, _) 이스케이프
     */
    public static String escapeLike(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    /**
     * 모델명 매칭 패턴 생성
     */
    public static String modelPattern(String model) {
        if (model == null) {
            return null;
        }
        return MODEL_SEPARATOR.matcher(escapeLike(model.trim())).replaceAll("%");
    }

    /**
     * 대표 트림 추출 ("EX-L/EX-L Navi" -> "EX-L")
     */
    public static String primaryTrim(String trim) {
        if (trim == null) {
            return null;
        }
        String primary = trim.split(TRIM_DELIMITER, -1)[0].trim();
        return primary.isEmpty() ? null : primary;
    }

    /**
     * 대표 트림 접두어 매칭 패턴 ("EX-L" -> "EX-L%")
     */
    public static String trimPrefixPattern(String trim) {
        String primary = primaryTrim(trim);
        return primary == null ? null : escapeLike(primary) + "%";
    }
}
