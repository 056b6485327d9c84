package com.pumainbox.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    private String status;
    private String db;

    public static HealthResponse connected() {
        return new HealthResponse("ok", "connected");
    }
}
