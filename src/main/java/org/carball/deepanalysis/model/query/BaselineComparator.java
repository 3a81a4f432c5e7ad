package org.carball.deepanalysis.model.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the current value of a probe is measured against.
 */
public enum BaselineComparator {
    PREVIOUS("previous"),
    BUDGET("budget");

    private final String value;

    BaselineComparator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
