package com.entity.profiling.geo;

import com.entity.profiling.core.AtomicFiles;
import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.ReferenceDataException;
import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.CrosswalkMethod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Persists a built crosswalk so later runs can skip the geometry work.
 *
 * <pre>
 * {"metadata": {"projections": {...}, "min_overlap": 0.01, "entity_count": 2, "link_count": 3, "fallback_count": 1},
 *  "crosswalk": {"E1": [{"county_unit_id": "04005", "weight": 0.6, "method": "AREA_WEIGHTED", "overlap_area_sqkm": 12.5}]}}
 * </pre>
 */
public class CrosswalkStore {
    private static final Logger log = LoggerFactory.getLogger(CrosswalkStore.class);

    private final ObjectMapper mapper;
    private final CrosswalkOptions options;

    public CrosswalkStore() {
        this(JsonSupport.mapper(), CrosswalkOptions.defaults());
    }

    public CrosswalkStore(ObjectMapper mapper, CrosswalkOptions options) {
        this.mapper = mapper;
        this.options = options;
    }

    /**
     * Atomically writes the crosswalk to {@code path}.
     *
     * @throws UncheckedIOException if the file cannot be written; any previous file is left intact
     */
    public void write(GeographicCrosswalk crosswalk, Path path) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode metadata = root.putObject("metadata");
        ObjectNode projectionNode = metadata.putObject("projections");
        for (ProjectionRegion region : ProjectionRegion.values()) {
            projectionNode.put(region.name().toLowerCase(Locale.ROOT), region.crsCode());
        }
        metadata.put("min_overlap", options.getMinOverlap());
        metadata.put("entity_count", crosswalk.entityCount());
        metadata.put("link_count", crosswalk.linkCount());
        metadata.put("fallback_count", crosswalk.fallbackCount());

        ObjectNode body = root.putObject("crosswalk");
        for (String entityId : crosswalk.entityIds()) {
            ArrayNode links = body.putArray(entityId);
            for (CrosswalkEntry entry : crosswalk.entriesFor(entityId)) {
                ObjectNode link = links.addObject();
                link.put("county_unit_id", entry.countyUnitId());
                link.put("weight", entry.overlapWeight());
                link.put("method", entry.method().name());
                link.put("overlap_area_sqkm", entry.overlapAreaSqKm());
            }
        }

        try {
            AtomicFiles.write(path, mapper.writeValueAsBytes(root));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write crosswalk " + path, e);
        }
        log.info("crosswalk.saved path={} entities={} links={}", path, crosswalk.entityCount(), crosswalk.linkCount());
    }

    /**
     * Reads a stored crosswalk.
     *
     * @throws ReferenceDataException if the file is missing, unreadable or violates the weight invariant
     */
    public GeographicCrosswalk read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ReferenceDataException("Missing crosswalk: " + path);
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ReferenceDataException("Unreadable crosswalk " + path + ": " + e.getMessage(), e);
        }
        if (root == null || !root.path("crosswalk").isObject()) {
            throw new ReferenceDataException("Crosswalk " + path + " has no 'crosswalk' object");
        }

        List<CrosswalkEntry> entries = new ArrayList<>();
        try {
            Iterator<Map.Entry<String, JsonNode>> fields = root.get("crosswalk").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                for (JsonNode link : field.getValue()) {
                    entries.add(new CrosswalkEntry(
                            field.getKey(),
                            link.path("county_unit_id").asText(),
                            link.path("weight").asDouble(),
                            CrosswalkMethod.valueOf(link.path("method").asText(CrosswalkMethod.AREA_WEIGHTED.name())),
                            link.path("overlap_area_sqkm").asDouble(0.0)));
                }
            }
            GeographicCrosswalk crosswalk = GeographicCrosswalk.of(entries, options.getWeightTolerance());
            log.info("crosswalk.loaded path={} entities={} links={}", path, crosswalk.entityCount(), crosswalk.linkCount());
            return crosswalk;
        } catch (IllegalArgumentException e) {
            throw new ReferenceDataException("Invalid crosswalk " + path + ": " + e.getMessage(), e);
        }
    }
}
