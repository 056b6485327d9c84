package com.pumainbox.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error body shared by every route: {@code {"detail": ...}}, where detail is
 * either a message or a list of field errors.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private Object detail;

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message);
    }

    public static ErrorResponse of(List<String> errors) {
        return new ErrorResponse(errors);
    }
}
