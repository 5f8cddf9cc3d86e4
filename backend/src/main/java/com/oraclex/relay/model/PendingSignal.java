package com.oraclex.relay.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
public class PendingSignal {

    private final String cmdId;
    private final TradeSignal signal;
    private final Instant createdAt;
    private SignalStatus status;
    private Instant approvedAt;

    public PendingSignal(String cmdId, TradeSignal signal, Instant createdAt) {
        this.cmdId = cmdId;
        this.signal = signal;
        this.createdAt = createdAt;
        this.status = SignalStatus.PENDING;
    }

    public boolean isApproved() {
        return status == SignalStatus.APPROVED;
    }

    public void approve(Instant when) {
        this.status = SignalStatus.APPROVED;
        this.approvedAt = when;
    }
}
