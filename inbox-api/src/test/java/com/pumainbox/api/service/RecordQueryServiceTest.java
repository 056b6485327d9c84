package com.pumainbox.api.service;

import com.pumainbox.api.repository.InboxRepository;
import com.pumainbox.api.repository.InboxTable;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecordQueryServiceTest {

    @Mock
    private InboxRepository inboxRepository;

    @Mock
    private Timer dbQueryTimer;

    private RecordQueryService recordQueryService;

    @BeforeEach
    void setUp() {
        when(dbQueryTimer.record(any(Supplier.class)))
                .thenAnswer(invocation -> {
                    Supplier<?> supplier = invocation.getArgument(0);
                    return supplier.get();
                });
        recordQueryService = new RecordQueryService(inboxRepository, dbQueryTimer);
    }

    @Test
    void testListCases() {
        // Given
        List<Map<String, Object>> rows = List.of(Map.of("case_id", 3L));
        when(inboxRepository.list(InboxTable.CASES, 20, 0)).thenReturn(rows);

        // When & Then
        assertEquals(rows, recordQueryService.listCases(20, 0));
    }

    @Test
    void testListAiDecisions() {
        // Given
        List<Map<String, Object>> rows = List.of(Map.of("decision", "escalate"));
        when(inboxRepository.list(InboxTable.AI_DECISIONS, 5, 10)).thenReturn(rows);

        // When & Then
        assertEquals(rows, recordQueryService.listAiDecisions(5, 10));
    }

    @Test
    void testListRiskEvents() {
        // When
        recordQueryService.listRiskEvents(1, 2);

        // Then
        verify(inboxRepository, times(1)).list(InboxTable.RISK_EVENTS, 1, 2);
        verify(dbQueryTimer, times(1)).record(any(Supplier.class));
    }
}
