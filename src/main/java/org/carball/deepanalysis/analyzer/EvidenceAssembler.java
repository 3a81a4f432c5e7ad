package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.EvidenceTable;
import org.carball.deepanalysis.model.analysis.EvidenceTable.Slot;
import org.carball.deepanalysis.model.analysis.FactKind;
import org.carball.deepanalysis.model.metric.ComparatorKind;
import org.carball.deepanalysis.model.metric.ImprovementDirection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Derives the "what" rows, the start of the adverse trend and the SCQA narrative from the
 * drill evidence. Reads the where, when and extent lists only and never mutates the table,
 * so repeated calls over the same table give the same answer.
 */
public class EvidenceAssembler {

    // 2025, 2025-03, 2025/03, 2025-Q1, 2025-P03, FY2025-03, 2025-03-15
    private static final Pattern BUCKET_LABEL = Pattern.compile(
            "^(?:FY\\s*)?(\\d{4})(?:[-/ ]?(?:Q([1-4])|P?(\\d{1,2}))(?:[-/](\\d{1,2}))?)?$",
            Pattern.CASE_INSENSITIVE);

    /**
     * Metric context the derived facts are phrased in.
     */
    public record AssemblyContext(
            String metricName,
            String timeframe,
            String baselineTimeframe,
            boolean filtersPresent,
            ImprovementDirection direction,
            ComparatorKind comparator
    ) {
    }

    public record Assessment(
            List<EvidenceFact> whatIs,
            List<EvidenceFact> whatIsNot,
            String whenStarted,
            String narrative
    ) {
    }

    public Assessment assemble(EvidenceTable table, List<ChangePoint> changePoints, AssemblyContext context) {
        List<EvidenceFact> whatIs = new ArrayList<>();
        whatIs.add(EvidenceFact.attribute(FactKind.METRIC, "metric", context.metricName()));

        EvidenceFact timeframe = EvidenceFact.attribute(FactKind.TIMEFRAME, "current", context.timeframe());
        timeframe.getAttributes().put("baseline", baselineLabel(context));
        timeframe.getAttributes().put("comparator", context.comparator() != null ? context.comparator().getValue() : null);
        whatIs.add(timeframe);

        Optional<EvidenceFact> overall = overallChange(table);
        overall.ifPresent(fact -> whatIs.add(overallFact(fact)));

        Optional<ChangePoint> largest = largest(changePoints);
        if (largest.isPresent()) {
            ChangePoint cp = largest.get();
            whatIs.add(EvidenceFact.builder()
                    .kind(FactKind.LARGEST_CHANGE)
                    .dimension(cp.getDimension())
                    .key(cp.getKey())
                    .current(cp.getCurrentValue())
                    .previous(cp.getPreviousValue())
                    .delta(cp.getDelta())
                    .build());
        } else {
            whatIs.add(EvidenceFact.builder()
                    .kind(FactKind.NO_SIGNAL)
                    .note("No segment stood out against the baseline")
                    .build());
        }

        whatIs.add(EvidenceFact.builder()
                .kind(FactKind.FILTERS)
                .note(context.filtersPresent() ? "Filters applied" : "No filters applied")
                .build());

        List<EvidenceFact> whatIsNot = new ArrayList<>();
        mostStable(table.get(Slot.WHERE_IS_NOT)).ifPresent(f -> whatIsNot.add(stableFact(f, "where")));
        mostStable(table.get(Slot.WHEN_IS_NOT)).ifPresent(f -> whatIsNot.add(stableFact(f, "when")));

        String whenStarted = whenStarted(table, context.direction());
        String narrative = narrative(context, overall.orElse(null), largest.orElse(null), whenStarted);
        return new Assessment(whatIs, whatIsNot, whenStarted, narrative);
    }

    /**
     * Earliest bucket, among the temporal facts that moved in the adverse direction.
     * Unparseable labels sort after every parseable one, keeping their original order.
     */
    public String whenStarted(EvidenceTable table, ImprovementDirection direction) {
        ImprovementDirection effective = direction != null ? direction : ImprovementDirection.HIGHER_IS_BETTER;
        return Stream.concat(table.get(Slot.WHEN_IS).stream(), table.get(Slot.WHEN_IS_NOT).stream())
                .filter(f -> f.getBucket() != null && f.hasDelta())
                .filter(f -> effective.isAdverse(f.getDelta()))
                .map(EvidenceFact::getBucket)
                .min(Comparator.comparingLong(label -> sortKey(label).orElse(Long.MAX_VALUE)))
                .orElse(null);
    }

    /**
     * year * 10000 + month * 100 + day; quarters map to their first month and bare years
     * sort ahead of their months.
     */
    static OptionalLong sortKey(String label) {
        if (label == null) {
            return OptionalLong.empty();
        }
        Matcher m = BUCKET_LABEL.matcher(label.trim());
        if (!m.matches()) {
            return OptionalLong.empty();
        }
        long year = Long.parseLong(m.group(1));
        int month = 0;
        if (m.group(2) != null) {
            month = (Integer.parseInt(m.group(2)) - 1) * 3 + 1;
        } else if (m.group(3) != null) {
            month = Integer.parseInt(m.group(3));
            if (month < 1 || month > 12) {
                return OptionalLong.empty();
            }
        }
        int day = m.group(4) != null ? Integer.parseInt(m.group(4)) : 0;
        if (day > 31) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(year * 10000 + month * 100L + day);
    }

    private static Optional<EvidenceFact> overallChange(EvidenceTable table) {
        return table.get(Slot.EXTENT_IS).stream()
                .filter(f -> f.getKind() == FactKind.OVERALL_CHANGE)
                .findFirst();
    }

    private static EvidenceFact overallFact(EvidenceFact extent) {
        EvidenceFact fact = EvidenceFact.builder()
                .kind(FactKind.OVERALL_CHANGE)
                .current(extent.getCurrent())
                .previous(extent.getPrevious())
                .delta(extent.getDelta())
                .ratio(extent.getRatio())
                .build();
        if (extent.getRatio() != null) {
            fact.getAttributes().put("percent", round(extent.getRatio() * 100.0));
        }
        return fact;
    }

    private static Optional<ChangePoint> largest(List<ChangePoint> changePoints) {
        ChangePoint best = null;
        for (ChangePoint cp : changePoints) {
            if (best == null || cp.absoluteDelta() > best.absoluteDelta()) {
                best = cp;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * A "within threshold" fact wins; otherwise the smallest absolute delta, first one on ties.
     */
    private static Optional<EvidenceFact> mostStable(List<EvidenceFact> facts) {
        Optional<EvidenceFact> within = facts.stream().filter(EvidenceFact::isWithinThreshold).findFirst();
        if (within.isPresent()) {
            return within;
        }
        EvidenceFact best = null;
        for (EvidenceFact fact : facts) {
            if (fact.hasDelta() && (best == null || Math.abs(fact.getDelta()) < Math.abs(best.getDelta()))) {
                best = fact;
            }
        }
        return Optional.ofNullable(best);
    }

    private static EvidenceFact stableFact(EvidenceFact source, String axis) {
        EvidenceFact fact = source.toBuilder()
                .kind(FactKind.MOST_STABLE)
                .attributes(new LinkedHashMap<>(source.getAttributes()))
                .build();
        fact.getAttributes().put("axis", axis);
        return fact;
    }

    private static String narrative(AssemblyContext context, EvidenceFact overall, ChangePoint largest,
                                    String whenStarted) {
        StringBuilder text = new StringBuilder();
        text.append("Situation: Reviewing ").append(context.metricName())
                .append(" for ").append(context.timeframe())
                .append(" against ").append(baselineLabel(context)).append(". ");

        text.append("Complication: ");
        if (overall != null && overall.hasDelta()) {
            text.append(String.format(Locale.ROOT, "the metric moved by %s", number(overall.getDelta())));
            if (overall.getRatio() != null) {
                text.append(String.format(Locale.ROOT, " (%s%%)", number(round(overall.getRatio() * 100.0))));
            }
            text.append(". ");
        } else {
            text.append("the overall movement could not be measured. ");
        }

        text.append("Question: Which segments drive the change? ");

        text.append("Answer: ");
        if (largest != null) {
            text.append(String.format(Locale.ROOT, "the largest change is %s = %s with a delta of %s",
                    largest.getDimension(), largest.getKey(), number(largest.getDelta())));
        } else {
            text.append("no segment stood out against the baseline");
        }
        if (whenStarted != null) {
            text.append(", starting around ").append(whenStarted);
        }
        text.append('.');
        return text.toString();
    }

    private static String baselineLabel(AssemblyContext context) {
        if (context.comparator() == ComparatorKind.BUDGET) {
            return "budget";
        }
        return context.baselineTimeframe() != null ? context.baselineTimeframe() : "the prior period";
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static String number(double value) {
        return value == Math.rint(value) ? String.format(Locale.ROOT, "%.0f", value)
                : String.format(Locale.ROOT, "%.2f", value);
    }
}
