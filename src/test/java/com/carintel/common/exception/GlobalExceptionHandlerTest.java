package com.carintel.common.exception;

import com.carintel.common.dto.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapMissingStaticResourceToNotFound() {
        // When
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleUnknownPath(new NoResourceFoundException(HttpMethod.GET, "vehicles/nope/extra"));

        // Then
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("not_found", response.getBody().getError().getCode());
    }

    @Test
    void shouldMapMissingHandlerToNotFound() {
        // When
        ResponseEntity<ApiResponse<Void>> response = handler.handleUnknownPath(
                new NoHandlerFoundException("GET", "/vehicles/nope/extra", new HttpHeaders()));

        // Then
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("not_found", response.getBody().getError().getCode());
        assertNull(response.getBody().getData());
    }
}
