package com.oraclex.relay.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Analysis section with a few typed fields. Keys the engine sends beyond those are kept
 * as received and written back out next to the typed ones.
 */
public abstract class AnalysisSection {

    private final Map<String, Object> additionalFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void setAdditionalField(String name, Object value) {
        additionalFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalFields() {
        return Collections.unmodifiableMap(additionalFields);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return additionalFields.equals(((AnalysisSection) other).additionalFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(additionalFields);
    }
}
