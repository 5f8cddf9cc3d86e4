package com.oraclex.relay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubmitSignalResponse {

    public static final String PENDING_APPROVAL = "PENDING_APPROVAL";

    private String status;
    private String cmdId;
    private long autoApproveInSec;
}
