package com.pumainbox.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

@Data
public class EmailInboxRequest {

    // local part, '@', and a domain containing a dot
    static final String ADDRESS_PATTERN = "^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$";

    @JsonProperty("message_id")
    private String messageId;

    @JsonProperty("internet_message_id")
    private String internetMessageId;

    @JsonProperty("from_name")
    private String fromName;

    @NotBlank(message = "field required")
    @Email(regexp = ADDRESS_PATTERN, message = "value is not a valid email address")
    @JsonProperty("from_email")
    private String fromEmail;

    @NotBlank(message = "field required")
    @Email(regexp = ADDRESS_PATTERN, message = "value is not a valid email address")
    @JsonProperty("to_email")
    private String toEmail;

    @JsonProperty("subject")
    private String subject;

    @JsonProperty("body_preview")
    private String bodyPreview;

    @JsonProperty("body_html")
    private String bodyHtml;

    /** ISO-8601 timestamp, passed to the database as text. */
    @JsonProperty("received_at")
    private String receivedAt;

    @JsonProperty("channel")
    private String channel = "email";

    @JsonProperty("processing_status")
    private String processingStatus = "new";

    @JsonProperty("linked_case_id")
    private Integer linkedCaseId;

    @JsonProperty("raw_payload")
    private Map<String, Object> rawPayload;
}
