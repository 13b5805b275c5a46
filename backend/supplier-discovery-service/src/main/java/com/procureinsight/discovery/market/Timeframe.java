package com.procureinsight.discovery.market;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Timeframe {

    ONE_MONTH("1month"),
    THREE_MONTHS("3months"),
    SIX_MONTHS("6months"),
    ONE_YEAR("1year");

    private final String value;

    Timeframe(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Timeframe fromValue(String raw) {
        for (Timeframe timeframe : values()) {
            if (timeframe.value.equalsIgnoreCase(raw) || timeframe.name().equalsIgnoreCase(raw)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + raw);
    }
}
