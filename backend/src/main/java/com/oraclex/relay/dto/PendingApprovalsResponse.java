package com.oraclex.relay.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PendingApprovalsResponse {
    private int total;
    private List<PendingSignalSummary> items;
}
