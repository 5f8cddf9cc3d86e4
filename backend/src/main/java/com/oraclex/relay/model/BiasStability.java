package com.oraclex.relay.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BiasStability extends AnalysisSection {

    private Integer activeSinceMinutes;
    /** {@code null} until the bias has flipped at least once. */
    private Integer lastFlipMinutesAgo;

    public static BiasStability initial() {
        return new BiasStability(0, null);
    }
}
