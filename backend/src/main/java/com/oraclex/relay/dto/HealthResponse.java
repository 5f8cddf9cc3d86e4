package com.oraclex.relay.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class HealthResponse {
    private String status;
    private String name;
    private String version;
    private long uptime;
    private List<String> features;
}
