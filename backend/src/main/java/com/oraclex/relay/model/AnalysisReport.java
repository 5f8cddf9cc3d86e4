package com.oraclex.relay.model;

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
 * Analysis engine output for one symbol as received. Normalised into an
 * {@link AnalysisSnapshot} before it is cached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalysisReport {

    private String symbol;
    private Bias bias;
    private Integer greenCount;
    private Double confidence;
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

    public boolean hasSymbol() {
        return symbol != null && !symbol.isBlank();
    }

    public long greenIndicatorCount() {
        if (indicators == null) {
            return 0;
        }
        return indicators.values().stream()
                .filter(reading -> reading != null && reading.isGreen())
                .count();
    }
}
