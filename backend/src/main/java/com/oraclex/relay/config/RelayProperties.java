package com.oraclex.relay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "oraclex.relay")
@Data
@Validated
public class RelayProperties {

    @NotBlank
    private String name = "OracleX Trading Relay";

    @NotBlank
    private String version = "3.0";

    @Valid
    private Approval approval = new Approval();

    @Valid
    private Receipts receipts = new Receipts();

    @Data
    public static class Approval {
        // Reported countdown only, nothing promotes a signal when it reaches zero
        @Min(0)
        private long windowSeconds = 30;

        @Positive
        private double defaultLot = 0.1;

        @NotBlank
        private String defaultComment = "ORACLEX";

        @NotBlank
        private String commandIdPrefix = "OX_";
    }

    @Data
    public static class Receipts {
        @Positive
        private int maxRetained = 10_000;
    }
}
