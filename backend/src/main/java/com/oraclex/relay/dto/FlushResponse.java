package com.oraclex.relay.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FlushResponse {

    public static final String FLUSHED = "FLUSHED";

    private String status;
    private boolean ok;
    private int cleared;
}
