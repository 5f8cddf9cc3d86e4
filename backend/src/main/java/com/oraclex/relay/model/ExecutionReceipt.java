package com.oraclex.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Execution outcome reported back by the execution agent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionReceipt {

    private String cmdId;
    private String symbol;
    private String action;
    private Integer retcode;
    private String comment;
    private Map<String, Object> dashboardContext;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private String receiptId;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private Instant receivedAt;

    public boolean hasCmdId() {
        return cmdId != null && !cmdId.isBlank();
    }
}
