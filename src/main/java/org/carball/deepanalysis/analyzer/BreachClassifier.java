package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.model.analysis.ClassifiedGroup;
import org.carball.deepanalysis.model.analysis.GroupComparisonRow;
import org.carball.deepanalysis.model.analysis.ThresholdPolicy;

import java.util.ArrayList;
import java.util.List;

public final class BreachClassifier {

    private BreachClassifier() {
    }

    public static List<ClassifiedGroup> classify(List<GroupComparisonRow> rows, ThresholdPolicy policy) {
        List<ClassifiedGroup> classified = new ArrayList<>(rows.size());
        for (GroupComparisonRow row : rows) {
            classified.add(new ClassifiedGroup(row, policy.isBreach(row.ratio())));
        }
        return classified;
    }

    public static List<ClassifiedGroup> breaches(List<ClassifiedGroup> groups) {
        return groups.stream().filter(ClassifiedGroup::breach).toList();
    }

    public static List<ClassifiedGroup> within(List<ClassifiedGroup> groups) {
        return groups.stream().filter(g -> !g.breach()).toList();
    }
}
