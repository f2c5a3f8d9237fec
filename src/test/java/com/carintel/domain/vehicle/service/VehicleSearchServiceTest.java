package com.carintel.domain.vehicle.service;

import com.carintel.domain.vehicle.entity.AutocompleteEntry;
import com.carintel.domain.vehicle.repository.VehicleAggregateRepository;
import com.carintel.domain.vehicle.repository.VehicleSpecRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VehicleSearchServiceTest {

    @Mock
    private VehicleAggregateRepository aggregateRepository;

    @Mock
    private VehicleSpecRepository vehicleSpecRepository;

    private VehicleSearchService searchService;

    @BeforeEach
    void setUp() {
        searchService = new VehicleSearchService(new SearchQueryTokenizer(),
                aggregateRepository, vehicleSpecRepository);
    }

    @Test
    void shouldQueryAutocompleteViewWithYearAndEscapedTokens() {
        // Given
        AutocompleteEntry entry = entry(2020, "Honda", "Civic", "2020 Honda Civic");
        when(aggregateRepository.searchAutocomplete(2020, List.of("civic", "type\\_r"), 20))
                .thenReturn(List.of(entry));

        // When
        List<AutocompleteEntry> result = searchService.search("2020 Civic type_r", 20);

        // Then
        assertEquals(List.of(entry), result);
    }

    @Test
    void shouldCapLimitAtMaximum() {
        // Given
        when(aggregateRepository.searchAutocomplete(null, List.of("honda"), VehicleSearchService.MAX_LIMIT))
                .thenReturn(List.of());

        // When
        searchService.search("Honda", 500);

        // Then
        verify(aggregateRepository).searchAutocomplete(null, List.of("honda"), VehicleSearchService.MAX_LIMIT);
    }

    @Test
    void shouldFallBackAndDeduplicateWhenViewIsMissing() {
        // Given
        when(aggregateRepository.searchAutocomplete(any(), any(), eq(2)))
                .thenThrow(new BadSqlGrammarException("searchAutocomplete", "SELECT ...",
                        new SQLException("relation \"vehicle_autocomplete\" does not exist", "42P01")));
        when(vehicleSpecRepository.searchAutocomplete(null, List.of("honda"), 6)).thenReturn(List.of(
                entry(2020, "Honda", "Civic", null),
                entry(2020, "Honda", "Civic", null),
                entry(2021, "Honda", "Civic", null),
                entry(2020, "Honda", "Accord", null)));

        // When
        List<AutocompleteEntry> result = searchService.search("honda", 2);

        // Then
        assertEquals(2, result.size());
        assertEquals("2020 Honda Civic", result.get(0).getDisplayText());
        assertEquals("2021 Honda Civic", result.get(1).getDisplayText());
    }

    @Test
    void shouldPropagateNonRelationErrors() {
        // Given
        when(aggregateRepository.searchAutocomplete(any(), any(), eq(20)))
                .thenThrow(new BadSqlGrammarException("searchAutocomplete", "SELECT ...",
                        new SQLException("syntax error", "42601")));

        // When / Then
        assertThrows(BadSqlGrammarException.class, () -> searchService.search("civic", 20));
        verifyNoInteractions(vehicleSpecRepository);
    }

    private static AutocompleteEntry entry(int year, String make, String model, String displayText) {
        return AutocompleteEntry.builder().year(year).make(make).model(model).displayText(displayText).build();
    }
}
