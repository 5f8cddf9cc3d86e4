package com.oraclex.relay.service;

import com.oraclex.relay.dto.MarketStateView;
import com.oraclex.relay.dto.MergedSymbolView;
import com.oraclex.relay.model.AnalysisSnapshot;
import com.oraclex.relay.model.IndicatorReading;
import com.oraclex.relay.model.SymbolSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the dashboard payload by joining the price feed with cached analysis. Only
 * symbols the price feed knows about are listed.
 */
@Service
@RequiredArgsConstructor
public class StateMerger {

    private static final int DEFAULT_DIGITS = 5;

    private final SymbolStore symbolStore;
    private final AnalysisCache analysisCache;
    private final Clock clock;

    public MarketStateView buildView() {
        Instant now = clock.instant();
        Optional<Instant> lastBatch = symbolStore.lastBatchTime();
        List<MergedSymbolView> rows = symbolStore.allSnapshots().stream()
                .map(snapshot -> merge(snapshot, analysisCache.get(snapshot.getSymbol())
                        .orElseGet(() -> AnalysisSnapshot.defaults(snapshot.getSymbol()))))
                .toList();
        return MarketStateView.builder()
                .marketData(rows)
                .timestamp(lastBatch.map(Instant::toEpochMilli).orElse(null))
                .dataAgeSec(lastBatch.map(batch -> ageSeconds(batch, now)).orElse(0L))
                .symbolsCount(rows.size())
                .lastUpdate(now)
                .build();
    }

    MergedSymbolView merge(SymbolSnapshot price, AnalysisSnapshot analysis) {
        return MergedSymbolView.builder()
                .symbol(price.getSymbol())
                .price(resolvePrice(price))
                .bid(orZero(price.getBid()))
                .ask(orZero(price.getAsk()))
                .priceChange1h(orZero(price.getPriceChange1h()))
                .h1High(orZero(price.getH1High()))
                .h1Low(orZero(price.getH1Low()))
                .m5High(orZero(price.getM5High()))
                .m5Low(orZero(price.getM5Low()))
                .spreadPoints(orZero(price.getSpreadPoints()))
                .bias(analysis.bias())
                .greenCount(analysis.greenCount())
                .confidence(analysis.confidence())
                .insight(analysis.insight())
                .indicators(resolveIndicators(price, analysis))
                .marketRegime(analysis.marketRegime())
                .biasStability(analysis.biasStability())
                .confluenceBreakdown(analysis.confluenceBreakdown())
                .contextHistory(analysis.contextHistory())
                .stateStatistics(analysis.stateStatistics())
                .currentSession(analysis.currentSession())
                .sessionIntelligence(analysis.sessionIntelligence())
                .strategies(analysis.strategies())
                .confluence(analysis.confluence())
                .digits(price.getDigits() != null && price.getDigits() > 0 ? price.getDigits() : DEFAULT_DIGITS)
                .ohlcvMicro(orEmpty(price.getOhlcvMicro()))
                .ohlcvMacro(orEmpty(price.getOhlcvMacro()))
                .openTrades(orEmpty(price.getOpenTrades()))
                .pendingOrders(orEmpty(price.getPendingOrders()))
                .lastUpdatePriceFeed(price.getLastUpdate())
                .lastUpdateAnalysis(analysis.lastUpdate())
                .dataSource(MergedSymbolView.DATA_SOURCE)
                .build();
    }

    private double resolvePrice(SymbolSnapshot snapshot) {
        if (snapshot.getPrice() != null && snapshot.getPrice() != 0.0) {
            return snapshot.getPrice();
        }
        return orZero(snapshot.getAsk());
    }

    // The producer's own indicator cells stand in until the engine has covered the symbol
    private static Map<String, IndicatorReading> resolveIndicators(SymbolSnapshot price, AnalysisSnapshot analysis) {
        if (analysis.lastUpdate() != null || price.getIndicators() == null) {
            return analysis.indicators();
        }
        return price.getIndicators();
    }

    private static long ageSeconds(Instant from, Instant now) {
        return Math.max(0L, Duration.between(from, now).getSeconds());
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static <T> List<T> orEmpty(List<T> value) {
        return value != null ? value : List.of();
    }
}
