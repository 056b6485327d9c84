package com.pumainbox.api.service;

import com.pumainbox.api.dto.EmailInboxRequest;
import com.pumainbox.api.exception.DatabaseErrors;
import com.pumainbox.api.exception.EmailNotFoundException;
import com.pumainbox.api.exception.InsertFailedException;
import com.pumainbox.api.repository.InboxRepository;
import com.pumainbox.api.repository.InboxTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class EmailInboxService {

    private final InboxRepository inboxRepository;
    private final Counter emailsInsertedCounter;
    private final Counter emailInsertFailureCounter;
    private final Timer dbQueryTimer;

    public EmailInboxService(InboxRepository inboxRepository,
                             Counter emailsInsertedCounter,
                             Counter emailInsertFailureCounter,
                             Timer dbQueryTimer) {
        this.inboxRepository = inboxRepository;
        this.emailsInsertedCounter = emailsInsertedCounter;
        this.emailInsertFailureCounter = emailInsertFailureCounter;
        this.dbQueryTimer = dbQueryTimer;
    }

    /**
     * Stores one email and returns the row as the database wrote it, including
     * the generated {@code email_id} and any column defaults.
     *
     * @throws InsertFailedException if the statement fails for any reason
     */
    public Map<String, Object> insertEmail(EmailInboxRequest email) {
        try {
            Map<String, Object> row = dbQueryTimer.record(() -> inboxRepository.insertEmail(email));

            emailsInsertedCounter.increment();
            log.info("Stored inbox email. EmailId: {}, From: {}, MessageId: {}",
                    row != null ? row.get("email_id") : null, email.getFromEmail(), email.getMessageId());
            return row;

        } catch (DataAccessException e) {
            emailInsertFailureCounter.increment();
            log.error("Failed to store inbox email. From: {}, MessageId: {}",
                    email.getFromEmail(), email.getMessageId(), e);
            throw new InsertFailedException(DatabaseErrors.message(e), e);
        } catch (RuntimeException e) {
            emailInsertFailureCounter.increment();
            log.error("Unexpected error storing inbox email. From: {}", email.getFromEmail(), e);
            throw new InsertFailedException(e.getMessage(), e);
        }
    }

    public Map<String, Object> getEmail(long emailId) {
        Map<String, Object> row = dbQueryTimer.record(() -> inboxRepository.findEmailById(emailId).orElse(null));
        if (row == null) {
            throw new EmailNotFoundException(emailId);
        }
        return row;
    }

    public List<Map<String, Object>> listEmails(int limit, int offset) {
        log.info("Listing inbox emails. Limit: {}, Offset: {}", limit, offset);
        return dbQueryTimer.record(() -> inboxRepository.list(InboxTable.EMAIL_INBOX, limit, offset));
    }
}
