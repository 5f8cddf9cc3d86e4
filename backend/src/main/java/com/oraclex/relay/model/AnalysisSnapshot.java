package com.oraclex.relay.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete analysis record for one symbol. Every field is populated, either from the
 * engine's report or from the documented default, and a newer snapshot replaces an
 * older one entirely.
 */
public record AnalysisSnapshot(
        String symbol,
        Bias bias,
        int greenCount,
        double confidence,
        String insight,
        Map<String, IndicatorReading> indicators,
        MarketRegime marketRegime,
        BiasStability biasStability,
        Map<String, ConfluenceComponent> confluenceBreakdown,
        List<JsonNode> contextHistory,
        StateStatistics stateStatistics,
        String currentSession,
        SessionIntelligence sessionIntelligence,
        List<JsonNode> strategies,
        ConfluenceSummary confluence,
        Long lastUpdate
) {

    public static final String DEFAULT_INSIGHT = "Analyzing...";
    public static final String UNKNOWN_SESSION = "Unknown";

    public static AnalysisSnapshot from(AnalysisReport report, long receivedAtMillis) {
        return new AnalysisSnapshot(
                report.getSymbol(),
                report.getBias() != null ? report.getBias() : Bias.NEUTRAL,
                report.getGreenCount() != null ? report.getGreenCount() : 0,
                report.getConfidence() != null ? report.getConfidence() : 0.0,
                report.getInsight() != null ? report.getInsight() : DEFAULT_INSIGHT,
                report.getIndicators() != null ? freeze(report.getIndicators()) : Map.of(),
                report.getMarketRegime() != null ? report.getMarketRegime() : MarketRegime.unknown(),
                report.getBiasStability() != null ? report.getBiasStability() : BiasStability.initial(),
                report.getConfluenceBreakdown() != null ? freeze(report.getConfluenceBreakdown()) : ConfluenceComponent.defaultBreakdown(),
                report.getContextHistory() != null ? freeze(report.getContextHistory()) : List.of(),
                report.getStateStatistics() != null ? report.getStateStatistics() : StateStatistics.baseline(),
                report.getCurrentSession() != null ? report.getCurrentSession() : UNKNOWN_SESSION,
                report.getSessionIntelligence() != null ? report.getSessionIntelligence() : SessionIntelligence.unknown(),
                report.getStrategies() != null ? freeze(report.getStrategies()) : List.of(),
                report.getConfluence() != null ? report.getConfluence() : ConfluenceSummary.empty(),
                receivedAtMillis
        );
    }

    /**
     * Stand-in used by the merger for a symbol the analysis engine has not covered yet.
     * {@code lastUpdate} stays {@code null} so consumers can tell it apart from real data.
     */
    public static AnalysisSnapshot defaults(String symbol) {
        return new AnalysisSnapshot(
                symbol,
                Bias.NEUTRAL,
                0,
                0.0,
                DEFAULT_INSIGHT,
                Map.of(),
                MarketRegime.unknown(),
                BiasStability.initial(),
                ConfluenceComponent.defaultBreakdown(),
                List.of(),
                StateStatistics.baseline(),
                UNKNOWN_SESSION,
                SessionIntelligence.unknown(),
                List.of(),
                ConfluenceSummary.empty(),
                null
        );
    }

    private static <K, V> Map<K, V> freeze(Map<K, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static <T> List<T> freeze(List<T> source) {
        return Collections.unmodifiableList(new ArrayList<>(source));
    }
}
