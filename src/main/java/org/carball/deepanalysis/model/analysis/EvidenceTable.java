package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Kepner-Tregoe Is/Is-Not table. Lists only grow during a run.
 */
public class EvidenceTable {

    public enum Slot {
        WHAT_IS, WHAT_IS_NOT,
        WHERE_IS, WHERE_IS_NOT,
        WHEN_IS, WHEN_IS_NOT,
        EXTENT_IS, EXTENT_IS_NOT
    }

    private final Map<Slot, List<EvidenceFact>> slots = new EnumMap<>(Slot.class);

    public EvidenceTable() {
        for (Slot slot : Slot.values()) {
            slots.put(slot, new ArrayList<>());
        }
    }

    public void append(Slot slot, EvidenceFact fact) {
        slots.get(slot).add(fact);
    }

    public void appendAll(Slot slot, List<EvidenceFact> facts) {
        slots.get(slot).addAll(facts);
    }

    public List<EvidenceFact> get(Slot slot) {
        return Collections.unmodifiableList(slots.get(slot));
    }

    @JsonIgnore
    public boolean isEmpty(Slot slot) {
        return slots.get(slot).isEmpty();
    }

    @JsonProperty("what_is")
    public List<EvidenceFact> getWhatIs() {
        return get(Slot.WHAT_IS);
    }

    @JsonProperty("what_is_not")
    public List<EvidenceFact> getWhatIsNot() {
        return get(Slot.WHAT_IS_NOT);
    }

    @JsonProperty("where_is")
    public List<EvidenceFact> getWhereIs() {
        return get(Slot.WHERE_IS);
    }

    @JsonProperty("where_is_not")
    public List<EvidenceFact> getWhereIsNot() {
        return get(Slot.WHERE_IS_NOT);
    }

    @JsonProperty("when_is")
    public List<EvidenceFact> getWhenIs() {
        return get(Slot.WHEN_IS);
    }

    @JsonProperty("when_is_not")
    public List<EvidenceFact> getWhenIsNot() {
        return get(Slot.WHEN_IS_NOT);
    }

    @JsonProperty("extent_is")
    public List<EvidenceFact> getExtentIs() {
        return get(Slot.EXTENT_IS);
    }

    @JsonProperty("extent_is_not")
    public List<EvidenceFact> getExtentIsNot() {
        return get(Slot.EXTENT_IS_NOT);
    }
}
