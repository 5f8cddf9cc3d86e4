package com.oraclex.relay.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Historical odds, in percent, of what the current state turned into.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StateStatistics extends AnalysisSection {

    private Double continuation;
    private Double reversal;
    private Double consolidation;
    private String bestSession;

    public static StateStatistics baseline() {
        return new StateStatistics(50.0, 25.0, 25.0, "Unknown");
    }
}
