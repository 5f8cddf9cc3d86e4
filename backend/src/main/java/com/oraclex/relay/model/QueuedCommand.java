package com.oraclex.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Approved instruction waiting for the execution agent. {@link #NONE} is what a poll
 * returns when nothing is queued.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueuedCommand {

    public static final String NONE_ACTION = "NONE";
    public static final QueuedCommand NONE = QueuedCommand.builder().action(NONE_ACTION).build();

    String cmdId;
    String symbol;
    String action;
    Double lot;
    Double sl;
    Double tp;
    Double price;
    String comment;

    @JsonIgnore
    public boolean isNone() {
        return cmdId == null && NONE_ACTION.equals(action);
    }
}
