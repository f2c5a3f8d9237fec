package com.carintel.domain.vehicle.controller;

import com.carintel.common.exception.GlobalExceptionHandler;
import com.carintel.domain.vehicle.dto.DecodedVin;
import com.carintel.domain.vehicle.dto.MarketCondition;
import com.carintel.domain.vehicle.dto.VehicleDto;
import com.carintel.domain.vehicle.entity.AutocompleteEntry;
import com.carintel.domain.vehicle.entity.VehicleSpec;
import com.carintel.domain.vehicle.exception.VehicleNotFoundException;
import com.carintel.domain.vehicle.exception.VinDecodeException;
import com.carintel.domain.vehicle.service.VehicleCatalogService;
import com.carintel.domain.vehicle.service.VehicleLookupService;
import com.carintel.domain.vehicle.service.VehicleSearchService;
import com.carintel.domain.vehicle.service.VinDecoderService;
import com.carintel.domain.vehicle.service.match.VehicleDescriptor;
import com.carintel.domain.vehicle.validator.VehicleRequestValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class VehicleControllerTest {

    private static final String VIN = "1HGCM82633A004352";
    private static final UUID SPEC_ID = UUID.fromString("6f1c7f4e-2f0a-4d55-9a3e-3c1f0b8a9d21");

    @Mock
    private VinDecoderService vinDecoderService;

    @Mock
    private VehicleLookupService lookupService;

    @Mock
    private VehicleCatalogService catalogService;

    @Mock
    private VehicleSearchService searchService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        VehicleController controller = new VehicleController(vinDecoderService, lookupService,
                catalogService, searchService, new VehicleRequestValidator());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldReturnDecodedVinInSnakeCase() throws Exception {
        // Given
        when(vinDecoderService.decode(VIN)).thenReturn(DecodedVin.builder()
                .vin(VIN).year(2003).make("HONDA").model("Accord").bodyType("Coupe").build());

        // When / Then
        mockMvc.perform(get("/vehicles/decode/{vin}", VIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.vin").value(VIN))
                .andExpect(jsonPath("$.data.body_type").value("Coupe"))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(content().string(not(containsString("\"warning\""))));
    }

    @Test
    void shouldIncludeDecoderWarningWhenPresent() throws Exception {
        // Given
        when(vinDecoderService.decode(VIN)).thenReturn(DecodedVin.builder()
                .vin(VIN).year(2003).make("HONDA").model("Accord")
                .warning("Check digit does not calculate properly").build());

        // When / Then
        mockMvc.perform(get("/vehicles/decode/{vin}", VIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.warning").value("Check digit does not calculate properly"));
    }

    @Test
    void shouldReportUpstreamFailureWithGenericMessage() throws Exception {
        // Given
        when(lookupService.lookupByVin(VIN)).thenThrow(VinDecodeException.upstreamUnavailable(
                "NHTSA vPIC request failed", new ResourceAccessException("Connection refused")));

        // When / Then
        mockMvc.perform(get("/vehicles/vin/{vin}", VIN))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("upstream_unavailable"))
                .andExpect(jsonPath("$.error.message").value("Vehicle decoding service is temporarily unavailable"));
    }

    @Test
    void shouldRejectLookupWithoutMake() throws Exception {
        mockMvc.perform(get("/vehicles/lookup").param("year", "2020").param("model", "Civic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("missing_params"))
                .andExpect(jsonPath("$.error.message").value("make is required"));

        verifyNoInteractions(lookupService);
    }

    @Test
    void shouldRejectNonNumericYear() throws Exception {
        mockMvc.perform(get("/vehicles/lookup")
                        .param("year", "twenty").param("make", "Honda").param("model", "Civic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_params"));
    }

    @Test
    void shouldLookupByYearMakeModel() throws Exception {
        // Given
        when(lookupService.lookup(any())).thenReturn(VehicleDto.LookupResponse.builder()
                .specs(VehicleSpec.builder().id(SPEC_ID).year(2020).make("Honda").model("Civic").mpgCity(30).build())
                .warranty(List.of())
                .marketValues(Map.of())
                .maintenance(List.of())
                .build());

        // When / Then
        mockMvc.perform(get("/vehicles/lookup")
                        .param("year", "2020").param("make", "Honda").param("model", "Civic").param("trim", " "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.specs.make").value("Honda"))
                .andExpect(jsonPath("$.data.specs.mpg_city").value(30))
                .andExpect(jsonPath("$.data.market_values").isMap());

        ArgumentCaptor<VehicleDescriptor> descriptor = ArgumentCaptor.forClass(VehicleDescriptor.class);
        verify(lookupService).lookup(descriptor.capture());
        assertEquals(2020, descriptor.getValue().getYear());
        assertNull(descriptor.getValue().getTrim());
    }

    @Test
    void shouldReturnNotFoundWhenLookupIsEmpty() throws Exception {
        when(lookupService.lookup(any())).thenThrow(new VehicleNotFoundException("No data found for this vehicle"));

        mockMvc.perform(get("/vehicles/lookup")
                        .param("year", "1901").param("make", "Ford").param("model", "Model T"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("not_found"));
    }

    @Test
    void shouldApplyDefaultAndMaximumSpecLimit() throws Exception {
        // Given
        when(lookupService.searchSpecs(any())).thenReturn(List.of());

        // When
        mockMvc.perform(get("/vehicles/specs").param("make", "Honda")).andExpect(status().isOk());
        mockMvc.perform(get("/vehicles/specs").param("limit", "1000")).andExpect(status().isOk());

        // Then
        ArgumentCaptor<VehicleDto.SpecSearchRequest> request = ArgumentCaptor.forClass(VehicleDto.SpecSearchRequest.class);
        verify(lookupService, times(2)).searchSpecs(request.capture());
        assertEquals(50, request.getAllValues().get(0).getLimit());
        assertEquals("Honda", request.getAllValues().get(0).getMake());
        assertEquals(100, request.getAllValues().get(1).getLimit());
    }

    @Test
    void shouldAcceptQueryAliasForSearch() throws Exception {
        // Given
        when(searchService.search("2020 civic", 20)).thenReturn(List.of(AutocompleteEntry.builder()
                .year(2020).make("Honda").model("Civic").displayText("2020 Honda Civic").build()));

        // When / Then
        mockMvc.perform(get("/vehicles/search").param("query", "2020 civic"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].display_text").value("2020 Honda Civic"));
    }

    @Test
    void shouldRejectShortSearchQuery() throws Exception {
        mockMvc.perform(get("/vehicles/search").param("q", "a"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_params"))
                .andExpect(jsonPath("$.error.message").value("Query must be at least 2 characters"));
    }

    @Test
    void shouldRejectInvalidSpecId() throws Exception {
        mockMvc.perform(get("/vehicles/{id}/specs", "12345"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_params"));
    }

    @Test
    void shouldNormalizeMarketCondition() throws Exception {
        // Given
        when(lookupService.getMarketValue(eq(SPEC_ID), eq(MarketCondition.CLEAN), isNull())).thenReturn(Map.of(
                "Clean", VehicleDto.MarketValueSet.builder().condition("Clean").tradeInCents(1_500_000L).build()));

        // When / Then
        mockMvc.perform(get("/vehicles/{id}/market-value", SPEC_ID).param("condition", "clean"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.Clean.trade_in_cents").value(1_500_000))
                .andExpect(jsonPath("$.data.Clean.private_party_cents").isEmpty());
    }

    @Test
    void shouldRejectUnknownMarketCondition() throws Exception {
        mockMvc.perform(get("/vehicles/{id}/market-value", SPEC_ID).param("condition", "excellent"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_params"));
    }

    @Test
    void shouldRejectNegativeCurrentMileage() throws Exception {
        mockMvc.perform(get("/vehicles/{id}/maintenance", SPEC_ID).param("current_mileage", "-5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_params"));

        verifyNoInteractions(lookupService);
    }

    @Test
    void shouldRejectNonGetMethods() throws Exception {
        mockMvc.perform(post("/vehicles/years"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error.code").value("method_not_allowed"));
    }

    @Test
    void shouldReturnNotFoundEnvelopeForUnknownPath() throws Exception {
        mockMvc.perform(get("/vehicles/nope/extra"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("not_found"));

        verifyNoInteractions(lookupService, catalogService, searchService);
    }
}
