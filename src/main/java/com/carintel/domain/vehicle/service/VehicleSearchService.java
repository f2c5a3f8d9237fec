package com.carintel.domain.vehicle.service;

import com.carintel.common.util.SqlStateUtils;
import com.carintel.domain.vehicle.entity.AutocompleteEntry;
import com.carintel.domain.vehicle.repository.VehicleAggregateRepository;
import com.carintel.domain.vehicle.repository.VehicleSpecRepository;
import com.carintel.domain.vehicle.service.match.MatchPatterns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 차량 자동완성 검색 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VehicleSearchService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 50;

    // 대체 조회 시 중복 제거 전 조회 배수
    private static final int FALLBACK_OVERFETCH = 3;

    private final SearchQueryTokenizer tokenizer;
    private final VehicleAggregateRepository aggregateRepository;
    private final VehicleSpecRepository vehicleSpecRepository;

    /**
     * 자동완성 검색 (정규화된 검색어와 절삭된 limit 기준으로 캐시)
     *
     * @param query 2자 이상으로 검증된 검색어
     * @param limit 최대 결과 수 (MAX_LIMIT으로 절삭)
     */
    @Cacheable(value = CacheResource.SEARCH,
            key = "#query.trim().toLowerCase(T(java.util.Locale).ROOT) + ':' + T(java.lang.Math).min(#limit, 50)")
    public List<AutocompleteEntry> search(String query, int limit) {
        int effectiveLimit = Math.min(limit, MAX_LIMIT);
        String normalized = query.trim().toLowerCase(Locale.ROOT);
        log.info("Searching vehicles: query='{}', limit={}", normalized, effectiveLimit);

        SearchQueryTokenizer.ParsedQuery parsed = tokenizer.tokenize(normalized);
        List<String> patterns = parsed.getTokens().stream()
                .map(MatchPatterns::escapeLike)
                .collect(Collectors.toList());

        try {
            return aggregateRepository.searchAutocomplete(parsed.getYear(), patterns, effectiveLimit);
        } catch (DataAccessException e) {
            if (!SqlStateUtils.isMissingRelation(e)) {
                throw e;
            }
            log.warn("Aggregate view vehicle_autocomplete unavailable, falling back to vehicle_specs");
        }

        List<AutocompleteEntry> rows = vehicleSpecRepository.searchAutocomplete(
                parsed.getYear(), patterns, effectiveLimit * FALLBACK_OVERFETCH);
        return deduplicate(rows, effectiveLimit);
    }

    /**
     * (연식, 제조사, 모델) 기준 중복 제거 (처음 나온 순서 유지)
     */
    static List<AutocompleteEntry> deduplicate(List<AutocompleteEntry> rows, int limit) {
        Set<String> seen = new HashSet<>();
        List<AutocompleteEntry> result = new ArrayList<>();

        for (AutocompleteEntry row : rows) {
            if (result.size() >= limit) {
                break;
            }
            String identity = row.getYear() + "|" + row.getMake() + "|" + row.getModel();
            if (seen.add(identity)) {
                result.add(AutocompleteEntry.builder()
                        .year(row.getYear())
                        .make(row.getMake())
                        .model(row.getModel())
                        .displayText(row.getYear() + " " + row.getMake() + " " + row.getModel())
                        .sampleVin(row.getSampleVin())
                        .build());
            }
        }
        return result;
    }
}
