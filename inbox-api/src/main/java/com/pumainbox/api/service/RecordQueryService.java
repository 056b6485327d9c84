package com.pumainbox.api.service;

import com.pumainbox.api.repository.InboxRepository;
import com.pumainbox.api.repository.InboxTable;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Read-only listings of the tables this service does not write: cases, AI decisions and risk events.
 */
@Slf4j
@Service
public class RecordQueryService {

    private final InboxRepository inboxRepository;
    private final Timer dbQueryTimer;

    public RecordQueryService(InboxRepository inboxRepository, Timer dbQueryTimer) {
        this.inboxRepository = inboxRepository;
        this.dbQueryTimer = dbQueryTimer;
    }

    public List<Map<String, Object>> listCases(int limit, int offset) {
        return list(InboxTable.CASES, limit, offset);
    }

    public List<Map<String, Object>> listAiDecisions(int limit, int offset) {
        return list(InboxTable.AI_DECISIONS, limit, offset);
    }

    public List<Map<String, Object>> listRiskEvents(int limit, int offset) {
        return list(InboxTable.RISK_EVENTS, limit, offset);
    }

    private List<Map<String, Object>> list(InboxTable table, int limit, int offset) {
        log.info("Listing {}. Limit: {}, Offset: {}", table.getTableName(), limit, offset);
        return dbQueryTimer.record(() -> inboxRepository.list(table, limit, offset));
    }
}
