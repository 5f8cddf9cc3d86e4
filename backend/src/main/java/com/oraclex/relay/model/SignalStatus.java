package com.oraclex.relay.model;

public enum SignalStatus {
    PENDING,
    APPROVED
}
