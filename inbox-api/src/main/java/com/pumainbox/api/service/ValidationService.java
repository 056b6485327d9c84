package com.pumainbox.api.service;

import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class ValidationService {

    private final Counter paginationValidationFailureCounter;

    public ValidationService(Counter paginationValidationFailureCounter) {
        this.paginationValidationFailureCounter = paginationValidationFailureCounter;
    }

    /**
     * Returns one message per rejected parameter, or an empty list when the pair is usable.
     * A zero limit is allowed and simply yields no rows; negative values never reach the database.
     */
    public List<String> validatePagination(int limit, int offset) {
        List<String> errors = new ArrayList<>();
        if (limit < 0) {
            errors.add("limit: must be greater than or equal to 0");
        }
        if (offset < 0) {
            errors.add("offset: must be greater than or equal to 0");
        }

        if (!errors.isEmpty()) {
            log.warn("Invalid pagination - limit: {}, offset: {}", limit, offset);
            paginationValidationFailureCounter.increment();
        }
        return errors;
    }
}
