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
public class ConfluenceSummary extends AnalysisSection {

    private Double total;
    private String consensus;

    public static ConfluenceSummary empty() {
        return new ConfluenceSummary(0.0, "0/4");
    }
}
