package com.carintel.domain.vehicle.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 자동완성 검색어 토큰화
 *
 * 4자리 연도(1990~2030)는 연식 필터, 2자 이상의 나머지 토큰은 텍스트 토큰
 */
@Component
public class SearchQueryTokenizer {

    static final int MIN_YEAR = 1990;
    static final int MAX_YEAR = 2030;
    private static final int MIN_TOKEN_LENGTH = 2;

    public ParsedQuery tokenize(String query) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return new ParsedQuery(null, Collections.emptyList());
        }

        Integer year = null;
        List<String> tokens = new ArrayList<>();

        for (String token : normalized.split("\\s+")) {
            if (isYear(token)) {
                // 연도 토큰이 여러 개면 마지막 값
                year = Integer.parseInt(token);
            } else if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }

        return new ParsedQuery(year, Collections.unmodifiableList(tokens));
    }

    private static boolean isYear(String token) {
        if (token.length() != 4) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        int value = Integer.parseInt(token);
        return value >= MIN_YEAR && value <= MAX_YEAR;
    }

    /**
     * 토큰화 결과
     */
    @Getter
    @AllArgsConstructor
    public static class ParsedQuery {
        private final Integer year;
        private final List<String> tokens;
    }
}
