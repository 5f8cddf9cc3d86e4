package com.oraclex.relay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RelayStatusResponse {
    private String status;
    private boolean relayActive;
    private int symbolsCount;
    private int dashboardCacheSize;
    private int tradesOpen;
    private int pendingApprovals;
    private int queueSize;
    private long receiptsRecorded;
    private int receiptsRetained;
    private Long lastUpdate;
    private Long dataAgeSec;
    private Instant timestamp;
}
