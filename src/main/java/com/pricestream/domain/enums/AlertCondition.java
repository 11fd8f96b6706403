package com.pricestream.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Condition an alert is evaluated against.
 *
 * <p>ABOVE and BELOW compare the live price with a fixed target price. PERCENT_CHANGE
 * compares the move from the price captured when the alert was created with a signed
 * threshold: positive thresholds fire on rises, negative thresholds on drops.
 */
public enum AlertCondition {
    ABOVE("above"),
    BELOW("below"),
    PERCENT_CHANGE("percent_change");

    private final String wireName;

    AlertCondition(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean usesTargetPrice() {
        return this != PERCENT_CHANGE;
    }

    @JsonCreator
    public static AlertCondition fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AlertCondition condition : values()) {
            if (condition.wireName.equals(normalized) || condition.name().equalsIgnoreCase(normalized)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown alert condition: " + value);
    }
}
