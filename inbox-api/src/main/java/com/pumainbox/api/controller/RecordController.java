package com.pumainbox.api.controller;

import com.pumainbox.api.dto.ErrorResponse;
import com.pumainbox.api.exception.DatabaseErrors;
import com.pumainbox.api.service.RecordQueryService;
import com.pumainbox.api.service.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@RestController
public class RecordController {

    private final RecordQueryService recordQueryService;
    private final ValidationService validationService;

    public RecordController(RecordQueryService recordQueryService, ValidationService validationService) {
        this.recordQueryService = recordQueryService;
        this.validationService = validationService;
    }

    @GetMapping("/cases")
    public ResponseEntity<?> listCases(@RequestParam(defaultValue = "20") int limit,
                                       @RequestParam(defaultValue = "0") int offset) {
        return page("cases", limit, offset, () -> recordQueryService.listCases(limit, offset));
    }

    @GetMapping("/ai-decisions")
    public ResponseEntity<?> listAiDecisions(@RequestParam(defaultValue = "20") int limit,
                                             @RequestParam(defaultValue = "0") int offset) {
        return page("ai decisions", limit, offset, () -> recordQueryService.listAiDecisions(limit, offset));
    }

    @GetMapping("/risk-events")
    public ResponseEntity<?> listRiskEvents(@RequestParam(defaultValue = "20") int limit,
                                            @RequestParam(defaultValue = "0") int offset) {
        return page("risk events", limit, offset, () -> recordQueryService.listRiskEvents(limit, offset));
    }

    private ResponseEntity<?> page(String what, int limit, int offset,
                                   Supplier<List<Map<String, Object>>> query) {
        List<String> paginationErrors = validationService.validatePagination(limit, offset);
        if (!paginationErrors.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ErrorResponse.of(paginationErrors));
        }

        try {
            return ResponseEntity.ok(query.get());

        } catch (RuntimeException e) {
            log.error("Failed to list {}. Limit: {}, Offset: {}", what, limit, offset, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of(DatabaseErrors.message(e)));
        }
    }
}
