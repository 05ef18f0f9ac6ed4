package com.entity.profiling.geo;

import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.ReferenceDataException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads boundary polygons from a JSON document:
 * <pre>
 * {"crs": "EPSG:4269",
 *  "features": [{"id": "04005", "state_fips": "04", "wkt": "POLYGON ((...))"}]}
 * </pre>
 * Coordinates must be geographic longitude/latitude; any other CRS is rejected because
 * the equal-area projections expect degrees.
 */
public class BoundaryLoader {
    private static final Logger log = LoggerFactory.getLogger(BoundaryLoader.class);

    static final Set<String> GEOGRAPHIC_CRS = Set.of("EPSG:4269", "EPSG:4326", "OGC:CRS84");

    private final ObjectMapper mapper;
    private final GeometryFactory geometryFactory;

    public BoundaryLoader() {
        this(JsonSupport.mapper(), new GeometryFactory());
    }

    public BoundaryLoader(ObjectMapper mapper, GeometryFactory geometryFactory) {
        this.mapper = mapper;
        this.geometryFactory = geometryFactory;
    }

    /**
     * Loads all features; features with unparseable or non-areal geometry are skipped
     * and logged.
     *
     * @throws ReferenceDataException if the file is missing, unreadable or not geographic
     */
    public List<BoundaryFeature> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ReferenceDataException("Missing boundary file: " + path);
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ReferenceDataException("Unreadable boundary file " + path + ": " + e.getMessage(), e);
        }
        if (root == null || !root.path("features").isArray()) {
            throw new ReferenceDataException("Boundary file " + path + " has no 'features' array");
        }
        String crs = root.path("crs").asText("");
        if (!GEOGRAPHIC_CRS.contains(crs)) {
            throw new ReferenceDataException(
                    "Boundary file " + path + " must use a geographic CRS " + GEOGRAPHIC_CRS + ", got '" + crs + "'");
        }

        WKTReader reader = new WKTReader(geometryFactory);
        List<BoundaryFeature> features = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : root.path("features")) {
            String id = node.path("id").asText("");
            String stateFips = node.hasNonNull("state_fips") ? node.get("state_fips").asText() : null;
            try {
                if (id.isBlank()) {
                    throw new IllegalArgumentException("feature without id");
                }
                Geometry geometry = reader.read(node.path("wkt").asText(""));
                if (geometry.getDimension() != 2) {
                    throw new IllegalArgumentException("geometry is not a polygon: " + geometry.getGeometryType());
                }
                features.add(new BoundaryFeature(id, stateFips, geometry));
            } catch (ParseException | IllegalArgumentException e) {
                skipped++;
                log.warn("boundary.skipped path={} id={} error={}", path, id, e.getMessage());
            }
        }
        log.info("boundary.loaded path={} features={} skipped={}", path, features.size(), skipped);
        return features;
    }
}
