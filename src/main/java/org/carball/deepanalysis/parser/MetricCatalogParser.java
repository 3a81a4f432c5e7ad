package org.carball.deepanalysis.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.model.metric.AggregationKind;
import org.carball.deepanalysis.model.metric.ComparatorKind;
import org.carball.deepanalysis.model.metric.ImprovementDirection;
import org.carball.deepanalysis.model.metric.MetricCatalog;
import org.carball.deepanalysis.model.metric.MetricDefinition;
import org.carball.deepanalysis.model.metric.ThresholdBand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a metric catalog from YAML.
 * <pre>
 * metrics:
 *   - id: gross_revenue
 *     name: Gross Revenue
 *     measure: Amount
 *     dimensions: [Customer Name, Product Name]
 *     hierarchies:
 *       customer: [Customer Type Name, Customer Name]
 *     thresholds:
 *       - comparison_type: mom
 *         yellow_threshold: -0.05
 * </pre>
 */
@Slf4j
public class MetricCatalogParser {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public MetricCatalog parse(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Metric catalog file not found: " + path);
        }
        MetricCatalog catalog = parse(Files.readString(path));
        log.info("Loaded {} metrics from {}", catalog.size(), path);
        return catalog;
    }

    public MetricCatalog parse(String yaml) throws IOException {
        JsonNode root = yamlMapper.readTree(yaml);
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Metric catalog must be a YAML mapping");
        }
        JsonNode metrics = root.get("metrics");
        if (metrics == null || !metrics.isArray()) {
            throw new IllegalStateException("Missing or invalid metrics section in metric catalog");
        }

        List<MetricDefinition> definitions = new ArrayList<>();
        for (JsonNode node : metrics) {
            definitions.add(parseMetric(node));
        }
        return new MetricCatalog(definitions);
    }

    private MetricDefinition parseMetric(JsonNode node) {
        String id = text(node, "id");
        if (id == null) {
            throw new IllegalStateException("Metric entry without id: " + node);
        }
        try {
            return MetricDefinition.builder()
                    .id(id)
                    .name(text(node, "name"))
                    .aggregation(AggregationKind.fromValue(text(node, "aggregation")))
                    .measure(text(node, "measure"))
                    .dimensions(stringList(node.get("dimensions")))
                    .hierarchies(hierarchies(node.get("hierarchies")))
                    .thresholds(thresholds(node.get("thresholds")))
                    .timeBucketDimension(text(node, "time_bucket"))
                    .improvementDirection(ImprovementDirection.fromValue(text(node, "improvement_direction")))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid definition for metric " + id + ": " + e.getMessage(), e);
        }
    }

    private Map<String, List<String>> hierarchies(JsonNode node) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> levels = stringList(field.getValue());
            if (levels.isEmpty()) {
                log.debug("Ignoring hierarchy vector {} without levels", field.getKey());
                continue;
            }
            result.put(field.getKey(), levels);
        }
        return result;
    }

    private List<ThresholdBand> thresholds(JsonNode node) {
        List<ThresholdBand> bands = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return bands;
        }
        for (JsonNode band : node) {
            String comparison = text(band, "comparison_type");
            bands.add(ThresholdBand.builder()
                    .comparator(comparison != null ? ComparatorKind.fromValue(comparison) : null)
                    .greenThreshold(number(band, "green_threshold"))
                    .yellowThreshold(number(band, "yellow_threshold"))
                    .redThreshold(number(band, "red_threshold"))
                    .inverseLogic(band.hasNonNull("inverse_logic") ? band.get("inverse_logic").asBoolean() : null)
                    .build());
        }
        return bands;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (!item.isNull() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException(field + " is not numeric: " + value.asText());
        }
        return value.asDouble();
    }
}
