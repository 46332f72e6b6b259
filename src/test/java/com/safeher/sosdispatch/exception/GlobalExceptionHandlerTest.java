package com.safeher.sosdispatch.exception;

import com.safeher.sosdispatch.dto.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void domainExceptions_mapToStatusCodes() {
        assertThat(handler.handleValidation(new ValidationException("bad")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.handleForbidden(new ForbiddenException("no")).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(handler.handleNotFound(new NotFoundException("gone")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleConflict(new ConflictException("taken")).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void conflict_bodyCarriesMessage() {
        ResponseEntity<ApiResponse> response = handler.handleConflict(new ConflictException("Alert is already closed"));

        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getMessage()).isEqualTo("Alert is already closed");
    }

    @Test
    void unexpected_mapsTo500() {
        assertThat(handler.handleGenericException(new IllegalStateException("boom")).getStatusCode())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
