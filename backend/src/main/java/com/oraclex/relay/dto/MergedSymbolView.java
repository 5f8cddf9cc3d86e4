package com.oraclex.relay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oraclex.relay.model.Bias;
import com.oraclex.relay.model.BiasStability;
import com.oraclex.relay.model.ConfluenceComponent;
import com.oraclex.relay.model.ConfluenceSummary;
import com.oraclex.relay.model.IndicatorReading;
import com.oraclex.relay.model.MarketRegime;
import com.oraclex.relay.model.SessionIntelligence;
import com.oraclex.relay.model.StateStatistics;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Dashboard row: price feed fields next to analysis fields for one symbol.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MergedSymbolView {

    public static final String DATA_SOURCE = "merged";

    private String symbol;
    private double price;
    private double bid;
    private double ask;
    @JsonProperty("price_change_1h")
    private double priceChange1h;
    private double h1High;
    private double h1Low;
    private double m5High;
    private double m5Low;
    private double spreadPoints;

    private Bias bias;
    private int greenCount;
    private double confidence;
    private String insight;
    private Map<String, IndicatorReading> indicators;
    private MarketRegime marketRegime;
    private BiasStability biasStability;
    private Map<String, ConfluenceComponent> confluenceBreakdown;
    private List<JsonNode> contextHistory;
    private StateStatistics stateStatistics;
    private String currentSession;
    private SessionIntelligence sessionIntelligence;
    private List<JsonNode> strategies;
    private ConfluenceSummary confluence;

    private int digits;
    private List<JsonNode> ohlcvMicro;
    private List<JsonNode> ohlcvMacro;
    private List<JsonNode> openTrades;
    private List<JsonNode> pendingOrders;

    @JsonProperty("last_update_mql5")
    private Long lastUpdatePriceFeed;
    @JsonProperty("last_update_python")
    private Long lastUpdateAnalysis;
    private String dataSource;
}
