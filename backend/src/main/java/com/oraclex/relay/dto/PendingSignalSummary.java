package com.oraclex.relay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oraclex.relay.model.SignalStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PendingSignalSummary {
    private String cmdId;
    private String symbol;
    private String action;
    private SignalStatus status;
    /** Epoch seconds. */
    private long createdAt;
    private long autoApproveInSec;
}
