package com.oraclex.relay.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulated price feed state for one symbol. Only ever grows field by field through
 * {@link #merge(SymbolUpdate, long)}; nothing a later update omits is lost.
 */
@Getter
@ToString
public class SymbolSnapshot {

    private final String symbol;
    private Double price;
    private Double bid;
    private Double ask;
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
    private long lastUpdate;

    private SymbolSnapshot(String symbol) {
        this.symbol = symbol;
    }

    public static SymbolSnapshot create(SymbolUpdate update, long receivedAtMillis) {
        SymbolSnapshot snapshot = new SymbolSnapshot(update.getSymbol());
        snapshot.merge(update, receivedAtMillis);
        return snapshot;
    }

    public void merge(SymbolUpdate update, long receivedAtMillis) {
        price = pick(update.getPrice(), price);
        bid = pick(update.getBid(), bid);
        ask = pick(update.getAsk(), ask);
        priceChange1h = pick(update.getPriceChange1h(), priceChange1h);
        h1High = pick(update.getH1High(), h1High);
        h1Low = pick(update.getH1Low(), h1Low);
        m5High = pick(update.getM5High(), m5High);
        m5Low = pick(update.getM5Low(), m5Low);
        spreadPoints = pick(update.getSpreadPoints(), spreadPoints);
        digits = pick(update.getDigits(), digits);
        ohlcvMicro = pickList(update.getOhlcvMicro(), ohlcvMicro);
        ohlcvMacro = pickList(update.getOhlcvMacro(), ohlcvMacro);
        openTrades = pickList(update.getOpenTrades(), openTrades);
        pendingOrders = pickList(update.getPendingOrders(), pendingOrders);
        if (update.getIndicators() != null) {
            indicators = Collections.unmodifiableMap(new LinkedHashMap<>(update.getIndicators()));
        }
        lastUpdate = update.getLastUpdate() != null ? update.getLastUpdate() : receivedAtMillis;
    }

    public SymbolSnapshot copy() {
        SymbolSnapshot copy = new SymbolSnapshot(symbol);
        copy.price = price;
        copy.bid = bid;
        copy.ask = ask;
        copy.priceChange1h = priceChange1h;
        copy.h1High = h1High;
        copy.h1Low = h1Low;
        copy.m5High = m5High;
        copy.m5Low = m5Low;
        copy.spreadPoints = spreadPoints;
        copy.digits = digits;
        copy.ohlcvMicro = ohlcvMicro;
        copy.ohlcvMacro = ohlcvMacro;
        copy.openTrades = openTrades;
        copy.pendingOrders = pendingOrders;
        copy.indicators = indicators;
        copy.lastUpdate = lastUpdate;
        return copy;
    }

    public int openTradeCount() {
        return openTrades == null ? 0 : openTrades.size();
    }

    private static <T> T pick(T incoming, T current) {
        return incoming != null ? incoming : current;
    }

    private static List<JsonNode> pickList(List<JsonNode> incoming, List<JsonNode> current) {
        return incoming != null ? Collections.unmodifiableList(new ArrayList<>(incoming)) : current;
    }
}
