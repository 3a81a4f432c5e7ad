package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
