package com.oraclex.relay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Bias {
    BULLISH,
    BEARISH,
    NEUTRAL;

    /**
     * Lenient read: the analysis engine is free to send casing variants, anything
     * unrecognised collapses to {@link #NEUTRAL}.
     */
    @JsonCreator
    public static Bias fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEUTRAL;
        }
        try {
            return Bias.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return NEUTRAL;
        }
    }

    @JsonValue
    public String toValue() {
        return name();
    }
}
