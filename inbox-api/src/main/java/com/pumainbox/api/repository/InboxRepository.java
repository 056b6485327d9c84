package com.pumainbox.api.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pumainbox.api.config.DatabaseProperties;
import com.pumainbox.api.dto.EmailInboxRequest;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-statement access to the inbox schema. Each call borrows its own connection
 * from the unpooled data source and releases it before returning.
 */
@Repository
public class InboxRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Map<String, Object>> rowMapper;

    private final String insertEmailSql;
    private final String selectEmailByIdSql;
    private final Map<InboxTable, String> listSql = new EnumMap<>(InboxTable.class);

    public InboxRepository(NamedParameterJdbcTemplate jdbcTemplate,
                           ObjectMapper objectMapper,
                           DatabaseProperties databaseProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new JsonColumnRowMapper(objectMapper);

        String schema = quoteIdentifier(databaseProperties.getSchema());

        this.insertEmailSql = "INSERT INTO " + schema + ".email_inbox ("
                + "message_id, internet_message_id, from_name, from_email, to_email, "
                + "subject, body_preview, body_html, received_at, channel, "
                + "processing_status, linked_case_id, raw_payload) "
                + "VALUES (:message_id, :internet_message_id, :from_name, :from_email, :to_email, "
                + ":subject, :body_preview, :body_html, :received_at, :channel, "
                + ":processing_status, :linked_case_id, :raw_payload) "
                + "RETURNING *";

        this.selectEmailByIdSql = "SELECT * FROM " + schema + ".email_inbox WHERE email_id = :email_id";

        for (InboxTable table : InboxTable.values()) {
            listSql.put(table, String.format("SELECT * FROM %s.%s ORDER BY %s DESC LIMIT :limit OFFSET :offset",
                    schema, table.getTableName(), table.getOrderColumn()));
        }
    }

    public Map<String, Object> insertEmail(EmailInboxRequest email) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("message_id", email.getMessageId())
                .addValue("internet_message_id", email.getInternetMessageId())
                .addValue("from_name", email.getFromName())
                .addValue("from_email", email.getFromEmail())
                .addValue("to_email", email.getToEmail())
                .addValue("subject", email.getSubject())
                .addValue("body_preview", email.getBodyPreview())
                .addValue("body_html", email.getBodyHtml())
                .addValue("received_at", email.getReceivedAt())
                .addValue("channel", email.getChannel())
                .addValue("processing_status", email.getProcessingStatus())
                .addValue("linked_case_id", email.getLinkedCaseId())
                .addValue("raw_payload", serializeRawPayload(email.getRawPayload()));

        return jdbcTemplate.queryForObject(insertEmailSql, params, rowMapper);
    }

    public Optional<Map<String, Object>> findEmailById(long emailId) {
        List<Map<String, Object>> rows = jdbcTemplate.query(selectEmailByIdSql,
                new MapSqlParameterSource("email_id", emailId), rowMapper);
        return rows.stream().findFirst();
    }

    public List<Map<String, Object>> list(InboxTable table, int limit, int offset) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", limit)
                .addValue("offset", offset);
        return jdbcTemplate.query(listSql.get(table), params, rowMapper);
    }

    public void ping() {
        jdbcTemplate.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
    }

    // An empty document is stored as NULL, same as a missing one.
    String serializeRawPayload(Map<String, Object> rawPayload) {
        if (rawPayload == null || rawPayload.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(rawPayload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("raw_payload is not serializable", e);
        }
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
