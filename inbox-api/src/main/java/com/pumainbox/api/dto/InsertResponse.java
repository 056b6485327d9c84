package com.pumainbox.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InsertResponse {

    private String status;
    private Map<String, Object> data;

    public static InsertResponse inserted(Map<String, Object> row) {
        return new InsertResponse("inserted", row);
    }
}
