package com.oraclex.relay.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trade signal as submitted for approval. Only {@code symbol} and {@code action} are
 * required; {@code cmdId} is generated when absent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeSignal {

    private String cmdId;
    private String symbol;
    private String action;
    private Double lot;
    private Double entry;
    private Double sl;
    private Double tp;
    private Double price;
    private Double confidence;
    private Integer greenCount;
    private String currentSession;
    private String comment;
}
