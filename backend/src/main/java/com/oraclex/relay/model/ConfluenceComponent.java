package com.oraclex.relay.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One weighted slice of the confluence score. Weights across a breakdown add up to 100.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfluenceComponent extends AnalysisSection {

    private Integer active;
    private Integer weight;
    private String name;

    public static Map<String, ConfluenceComponent> defaultBreakdown() {
        Map<String, ConfluenceComponent> breakdown = new LinkedHashMap<>();
        breakdown.put("ema_trend", new ConfluenceComponent(0, 40, "EMA Trend"));
        breakdown.put("momentum", new ConfluenceComponent(0, 30, "Momentum"));
        breakdown.put("structure", new ConfluenceComponent(0, 20, "Structure"));
        breakdown.put("filters", new ConfluenceComponent(0, 10, "Filters"));
        return breakdown;
    }
}
