package com.pumainbox.api.exception;

public class EmailNotFoundException extends RuntimeException {

    private final long emailId;

    public EmailNotFoundException(long emailId) {
        super("Email not found");
        this.emailId = emailId;
    }

    public long getEmailId() {
        return emailId;
    }
}
