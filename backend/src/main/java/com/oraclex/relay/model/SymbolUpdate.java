package com.oraclex.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial price/technical record pushed by the price feed. Every field is optional;
 * a {@code null} field means "not sent" and leaves the stored value alone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SymbolUpdate {

    private String symbol;
    private Double price;
    private Double bid;
    private Double ask;
    @JsonProperty("price_change_1h")
    private Double priceChange1h;
    private Double h1High;
    private Double h1Low;
    private Double m5High;
    private Double m5Low;
    private Double spreadPoints;
    private Integer digits;
    private List<JsonNode> ohlcvMicro;
    private List<JsonNode> ohlcvMacro;
    private List<JsonNode> openTrades;
    private List<JsonNode> pendingOrders;
    private Map<String, IndicatorReading> indicators;
    /** Producer-side update time, epoch millis. */
    private Long lastUpdate;

    public boolean hasSymbol() {
        return symbol != null && !symbol.isBlank();
    }
}
