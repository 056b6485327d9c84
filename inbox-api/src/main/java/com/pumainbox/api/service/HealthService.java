package com.pumainbox.api.service;

import com.pumainbox.api.repository.InboxRepository;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class HealthService {

    private final InboxRepository inboxRepository;
    private final Counter dbHealthFailureCounter;

    public HealthService(InboxRepository inboxRepository, Counter dbHealthFailureCounter) {
        this.inboxRepository = inboxRepository;
        this.dbHealthFailureCounter = dbHealthFailureCounter;
    }

    /**
     * Runs a trivial query on a fresh connection.
     *
     * @throws DataAccessException if the database cannot be reached or rejects the query;
     *         any failure, database or not, is counted before it propagates
     */
    public void checkDatabase() {
        try {
            inboxRepository.ping();
        } catch (RuntimeException e) {
            dbHealthFailureCounter.increment();
            log.error("Database health check failed", e);
            throw e;
        }
    }
}
