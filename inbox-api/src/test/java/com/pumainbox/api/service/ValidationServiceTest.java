package com.pumainbox.api.service;

import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ValidationServiceTest {

    @Mock
    private Counter paginationValidationFailureCounter;

    private ValidationService validationService;

    @BeforeEach
    void setUp() {
        validationService = new ValidationService(paginationValidationFailureCounter);
    }

    @Test
    void testValidatePagination_Defaults() {
        // When
        List<String> errors = validationService.validatePagination(20, 0);

        // Then
        assertTrue(errors.isEmpty());
        verify(paginationValidationFailureCounter, never()).increment();
    }

    @Test
    void testValidatePagination_ZeroLimitAllowed() {
        // When
        List<String> errors = validationService.validatePagination(0, 0);

        // Then
        assertTrue(errors.isEmpty());
    }

    @Test
    void testValidatePagination_LargeOffsetAllowed() {
        // When
        List<String> errors = validationService.validatePagination(20, 1_000_000);

        // Then
        assertTrue(errors.isEmpty());
    }

    @Test
    void testValidatePagination_NegativeLimit() {
        // When
        List<String> errors = validationService.validatePagination(-1, 0);

        // Then
        assertEquals(List.of("limit: must be greater than or equal to 0"), errors);
        verify(paginationValidationFailureCounter, times(1)).increment();
    }

    @Test
    void testValidatePagination_NegativeOffset() {
        // When
        List<String> errors = validationService.validatePagination(10, -5);

        // Then
        assertEquals(List.of("offset: must be greater than or equal to 0"), errors);
        verify(paginationValidationFailureCounter, times(1)).increment();
    }

    @Test
    void testValidatePagination_BothNegative() {
        // When
        List<String> errors = validationService.validatePagination(-1, -1);

        // Then
        assertEquals(2, errors.size());
        verify(paginationValidationFailureCounter, times(1)).increment();
    }
}
