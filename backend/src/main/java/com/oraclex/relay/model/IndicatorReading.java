package com.oraclex.relay.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One indicator cell as the producers send it: a {@code [state, value, label]} triple,
 * where {@code state} is a glyph such as 🟢 / 🔴 / ⚪.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"state", "value", "label"})
public class IndicatorReading {

    public static final String GREEN = "🟢";

    private String state;
    private Object value;
    private String label;

    @JsonIgnore
    public boolean isGreen() {
        return GREEN.equals(state);
    }
}
