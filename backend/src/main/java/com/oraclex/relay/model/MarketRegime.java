package com.oraclex.relay.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@EqualsAndHashCode(callSuper = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketRegime extends AnalysisSection {

    private String trend;
    private String volatility;
    private String structure;

    public static MarketRegime unknown() {
        return new MarketRegime("Unknown", "Normal", "Choppy");
    }
}
