package com.oraclex.relay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MarketStateView {
    private List<MergedSymbolView> marketData;
    /** Time of the last price batch, epoch millis; {@code null} before the first one. */
    private Long timestamp;
    private long dataAgeSec;
    private int symbolsCount;
    private Instant lastUpdate;
}
