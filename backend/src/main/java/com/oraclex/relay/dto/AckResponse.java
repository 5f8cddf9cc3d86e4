package com.oraclex.relay.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AckResponse {
    private boolean ok;
    private String message;
}
