package org.carball.deepanalysis.model.query;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RankKind {
    TOP("top"),
    BOTTOM("bottom");

    private final String value;

    RankKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
