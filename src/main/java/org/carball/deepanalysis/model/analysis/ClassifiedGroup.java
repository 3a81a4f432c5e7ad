package org.carball.deepanalysis.model.analysis;

public record ClassifiedGroup(GroupComparisonRow row, boolean breach) {

    public String groupKey() {
        return row.groupKey();
    }

    public double ratio() {
        return row.ratio();
    }
}
