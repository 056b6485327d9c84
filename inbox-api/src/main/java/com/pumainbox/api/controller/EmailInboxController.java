package com.pumainbox.api.controller;

import com.pumainbox.api.dto.EmailInboxRequest;
import com.pumainbox.api.dto.ErrorResponse;
import com.pumainbox.api.dto.InsertResponse;
import com.pumainbox.api.exception.DatabaseErrors;
import com.pumainbox.api.exception.EmailNotFoundException;
import com.pumainbox.api.exception.InsertFailedException;
import com.pumainbox.api.service.EmailInboxService;
import com.pumainbox.api.service.ValidationService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/email-inbox")
public class EmailInboxController {

    private final EmailInboxService emailInboxService;
    private final ValidationService validationService;

    public EmailInboxController(EmailInboxService emailInboxService, ValidationService validationService) {
        this.emailInboxService = emailInboxService;
        this.validationService = validationService;
    }

    @PostMapping
    public ResponseEntity<?> insertEmail(@Valid @RequestBody EmailInboxRequest request) {
        log.info("Received inbox email. From: {}, To: {}, MessageId: {}",
                request.getFromEmail(), request.getToEmail(), request.getMessageId());

        try {
            Map<String, Object> row = emailInboxService.insertEmail(request);
            return ResponseEntity.ok(InsertResponse.inserted(row));

        } catch (InsertFailedException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of("Insert failed: " + e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<?> listEmails(@RequestParam(defaultValue = "20") int limit,
                                        @RequestParam(defaultValue = "0") int offset) {
        List<String> paginationErrors = validationService.validatePagination(limit, offset);
        if (!paginationErrors.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ErrorResponse.of(paginationErrors));
        }

        try {
            List<Map<String, Object>> rows = emailInboxService.listEmails(limit, offset);
            return ResponseEntity.ok(rows);

        } catch (RuntimeException e) {
            log.error("Failed to list inbox emails. Limit: {}, Offset: {}", limit, offset, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of(DatabaseErrors.message(e)));
        }
    }

    @GetMapping("/{emailId}")
    public ResponseEntity<?> getEmail(@PathVariable long emailId) {
        try {
            return ResponseEntity.ok(emailInboxService.getEmail(emailId));

        } catch (EmailNotFoundException e) {
            log.warn("Inbox email not found. EmailId: {}", e.getEmailId());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to load inbox email. EmailId: {}", emailId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of(DatabaseErrors.message(e)));
        }
    }
}
