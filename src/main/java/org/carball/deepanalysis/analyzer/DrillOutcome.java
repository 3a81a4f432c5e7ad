package org.carball.deepanalysis.analyzer;

import lombok.Getter;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.EvidenceFact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facts produced by one drill, before they are filed into the evidence table. "Is" facts land in
 * where_is or when_is depending on the drill, "is-not" facts in the matching is-not list.
 */
@Getter
public class DrillOutcome {

    private final List<EvidenceFact> isFacts = new ArrayList<>();
    private final List<EvidenceFact> isNotFacts = new ArrayList<>();
    private final List<EvidenceFact> extentIs = new ArrayList<>();
    private final List<EvidenceFact> extentIsNot = new ArrayList<>();
    private final List<ChangePoint> changePoints = new ArrayList<>();

    // vector -> level where drilling stopped on a breach
    private final Map<String, String> stoppingLevels = new LinkedHashMap<>();

    public void addAll(DrillOutcome other) {
        isFacts.addAll(other.isFacts);
        isNotFacts.addAll(other.isNotFacts);
        extentIs.addAll(other.extentIs);
        extentIsNot.addAll(other.extentIsNot);
        changePoints.addAll(other.changePoints);
        other.stoppingLevels.forEach(stoppingLevels::putIfAbsent);
    }

    public boolean hasChangePoints() {
        return !changePoints.isEmpty();
    }

    public boolean isEmpty() {
        return isFacts.isEmpty() && isNotFacts.isEmpty() && extentIs.isEmpty() && extentIsNot.isEmpty();
    }
}
