package com.pumainbox.api.repository;

/**
 * Tables readable through the API, each with the column its listing is sorted by (newest first).
 */
public enum InboxTable {

    EMAIL_INBOX("email_inbox", "received_at"),
    CASES("cases", "created_at"),
    AI_DECISIONS("ai_decisions", "created_at"),
    RISK_EVENTS("risk_events", "created_at");

    private final String tableName;
    private final String orderColumn;

    InboxTable(String tableName, String orderColumn) {
        this.tableName = tableName;
        this.orderColumn = orderColumn;
    }

    public String getTableName() {
        return tableName;
    }

    public String getOrderColumn() {
        return orderColumn;
    }
}
