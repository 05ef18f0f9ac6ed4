package com.entity.profiling.hazard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The set of hazard types and metrics the engine knows how to aggregate.
 * Rows naming any other metric are malformed input.
 */
public final class MetricCatalog {

    public static final String SCORE_SUFFIX = "_RISKS";
    public static final String LOSS_SUFFIX = "_EALT";
    public static final String FREQUENCY_SUFFIX = "_AFREQ";

    private static final Map<String, String> NRI_HAZARDS;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("AVLN", "Avalanche");
        m.put("CFLD", "Coastal Flooding");
        m.put("CWAV", "Cold Wave");
        m.put("DRGT", "Drought");
        m.put("ERQK", "Earthquake");
        m.put("HAIL", "Hail");
        m.put("HWAV", "Heat Wave");
        m.put("HRCN", "Hurricane");
        m.put("ISTM", "Ice Storm");
        m.put("IFLD", "Inland Flooding");
        m.put("LNDS", "Landslide");
        m.put("LTNG", "Lightning");
        m.put("SWND", "Strong Wind");
        m.put("TRND", "Tornado");
        m.put("TSUN", "Tsunami");
        m.put("VLCN", "Volcanic Activity");
        m.put("WFIR", "Wildfire");
        m.put("WNTW", "Winter Weather");
        NRI_HAZARDS = Collections.unmodifiableMap(m);
    }

    private final Map<String, String> hazards;
    private final Map<String, MetricDefinition> metrics;

    private MetricCatalog(Map<String, String> hazards, Map<String, MetricDefinition> metrics) {
        this.hazards = Collections.unmodifiableMap(new TreeMap<>(hazards));
        this.metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
    }

    /**
     * County-level National Risk Index columns: per hazard a risk score, expected annual
     * loss and annualized frequency, plus the composite risk, loss, vulnerability and
     * resilience scores.
     */
    public static MetricCatalog nationalRiskIndex() {
        Builder builder = builder();
        NRI_HAZARDS.forEach(builder::hazard);
        return builder
                .composite("RISK_SCORE", MetricKind.INTENSIVE)
                .composite("EAL_SCORE", MetricKind.INTENSIVE)
                .composite("SOVI_SCORE", MetricKind.INTENSIVE)
                .composite("RESL_SCORE", MetricKind.INTENSIVE)
                .composite("EAL_VALT", MetricKind.EXTENSIVE)
                .composite("POPULATION", MetricKind.EXTENSIVE)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MetricDefinition> get(String metricName) {
        return Optional.ofNullable(metrics.get(metricName));
    }

    public boolean contains(String metricName) {
        return metrics.containsKey(metricName);
    }

    /**
     * All metrics in ascending name order.
     */
    public List<MetricDefinition> definitions() {
        return new ArrayList<>(metrics.values());
    }

    /**
     * Hazard type codes in ascending order.
     */
    public List<String> hazardCodes() {
        return new ArrayList<>(hazards.keySet());
    }

    public boolean isHazard(String code) {
        return hazards.containsKey(code);
    }

    public String hazardName(String code) {
        return hazards.getOrDefault(code, code);
    }

    public String scoreMetric(String hazardCode) {
        return hazardCode + SCORE_SUFFIX;
    }

    public String lossMetric(String hazardCode) {
        return hazardCode + LOSS_SUFFIX;
    }

    public static class Builder {
        private final Map<String, String> hazards = new LinkedHashMap<>();
        private final Map<String, MetricDefinition> metrics = new LinkedHashMap<>();

        /**
         * Registers a hazard type with its score, loss and frequency metrics.
         */
        public Builder hazard(String code, String displayName) {
            hazards.put(code, displayName);
            metric(new MetricDefinition(code + SCORE_SUFFIX, MetricKind.INTENSIVE, MetricRole.RISK_SCORE, code));
            metric(new MetricDefinition(code + LOSS_SUFFIX, MetricKind.EXTENSIVE, MetricRole.EXPECTED_LOSS, code));
            metric(new MetricDefinition(code + FREQUENCY_SUFFIX, MetricKind.INTENSIVE, MetricRole.FREQUENCY, code));
            return this;
        }

        public Builder composite(String name, MetricKind kind) {
            return metric(MetricDefinition.composite(name, kind));
        }

        public Builder metric(MetricDefinition definition) {
            if (metrics.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate metric: " + definition.name());
            }
            return this;
        }

        public MetricCatalog build() {
            return new MetricCatalog(hazards, metrics);
        }
    }
}
