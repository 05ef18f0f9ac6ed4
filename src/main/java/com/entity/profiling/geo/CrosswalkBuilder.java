package com.entity.profiling.geo;

import com.entity.profiling.core.model.CanonicalEntity;
import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.CrosswalkMethod;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds the entity-to-county crosswalk from boundary polygons.
 *
 * <p>Both entity and county polygons are projected into the equal-area projection of
 * their region before any area is measured, so a weight is
 * {@code area(entity ∩ county) / area(entity)} in square metres, not square degrees.
 * Overlaps under {@link CrosswalkOptions#getMinOverlap()} are dropped as slivers and the
 * remaining weights renormalized to 1.0. Entities without usable geometry get a single
 * fallback entry on their primary state.</p>
 */
public class CrosswalkBuilder {
    private static final Logger log = LoggerFactory.getLogger(CrosswalkBuilder.class);

    private static final double SQ_M_PER_SQ_KM = 1_000_000.0;

    private final CrosswalkOptions options;
    private final Map<ProjectionRegion, EqualAreaProjection> projections = new EnumMap<>(ProjectionRegion.class);

    public CrosswalkBuilder() {
        this(CrosswalkOptions.defaults());
    }

    public CrosswalkBuilder(CrosswalkOptions options) {
        this.options = options;
        for (ProjectionRegion region : ProjectionRegion.values()) {
            projections.put(region, new EqualAreaProjection(region));
        }
    }

    public CrosswalkOptions getOptions() {
        return options;
    }

    /**
     * Builds the crosswalk for every entity.
     *
     * @param entities         all canonical entities; each gets entries or is logged as having no geography
     * @param entityBoundaries entity polygons keyed by entity id (several features per entity are unioned)
     * @param countyBoundaries county polygons keyed by county FIPS
     */
    public GeographicCrosswalk build(Collection<CanonicalEntity> entities,
                                     List<BoundaryFeature> entityBoundaries,
                                     List<BoundaryFeature> countyBoundaries) {
        Map<ProjectionRegion, STRtree> countyIndex = indexCounties(countyBoundaries);

        Map<String, List<BoundaryFeature>> boundariesByEntity = new HashMap<>();
        for (BoundaryFeature feature : entityBoundaries) {
            boundariesByEntity.computeIfAbsent(feature.unitId(), k -> new ArrayList<>()).add(feature);
        }

        List<CanonicalEntity> sorted = new ArrayList<>(entities);
        sorted.sort(Comparator.comparing(CanonicalEntity::id));

        List<CrosswalkEntry> entries = new ArrayList<>();
        int areaWeighted = 0;
        int fallbacks = 0;
        int withoutGeography = 0;
        for (CanonicalEntity entity : sorted) {
            List<CrosswalkEntry> own = List.of();
            List<BoundaryFeature> features = boundariesByEntity.remove(entity.id());
            if (features != null) {
                own = areaWeighted(entity, features, countyIndex);
            }
            if (own.isEmpty()) {
                Optional<CrosswalkEntry> fallback = fallback(entity);
                if (fallback.isPresent()) {
                    own = List.of(fallback.get());
                    fallbacks++;
                } else {
                    withoutGeography++;
                    log.warn("crosswalk.noGeography entityId={} states={}", entity.id(), entity.geographicUnitIds());
                }
            } else {
                areaWeighted++;
            }
            entries.addAll(own);
        }
        for (String unknown : boundariesByEntity.keySet()) {
            log.warn("crosswalk.unknownEntityBoundary unitId={}", unknown);
        }

        GeographicCrosswalk crosswalk = GeographicCrosswalk.of(entries, options.getWeightTolerance());
        log.info("crosswalk.built entities={} areaWeighted={} fallback={} noGeography={} links={}",
                sorted.size(), areaWeighted, fallbacks, withoutGeography, crosswalk.linkCount());
        return crosswalk;
    }

    private Map<ProjectionRegion, STRtree> indexCounties(List<BoundaryFeature> countyBoundaries) {
        Map<String, BoundaryFeature> firstByCounty = new TreeMap<>();
        Map<String, Geometry> projectedByCounty = new TreeMap<>();
        for (BoundaryFeature county : countyBoundaries) {
            ProjectionRegion region = regionOf(county.stateFips(), county.unitId());
            Geometry projected = repair(projections.get(region).project(county.geometry()));
            Geometry existing = projectedByCounty.get(county.unitId());
            projectedByCounty.put(county.unitId(), existing == null ? projected : existing.union(projected));
            firstByCounty.putIfAbsent(county.unitId(), county);
        }

        Map<ProjectionRegion, STRtree> trees = new EnumMap<>(ProjectionRegion.class);
        for (Map.Entry<String, Geometry> e : projectedByCounty.entrySet()) {
            BoundaryFeature county = firstByCounty.get(e.getKey());
            ProjectionRegion region = regionOf(county.stateFips(), county.unitId());
            trees.computeIfAbsent(region, r -> new STRtree())
                    .insert(e.getValue().getEnvelopeInternal(), new ProjectedCounty(e.getKey(), e.getValue()));
        }
        trees.values().forEach(STRtree::build);
        return trees;
    }

    /**
     * Features are grouped by projection region and each group is intersected only with the
     * counties of its own region. The entity area is the sum of the per-region projected areas.
     */
    private List<CrosswalkEntry> areaWeighted(CanonicalEntity entity, List<BoundaryFeature> features,
                                              Map<ProjectionRegion, STRtree> countyIndex) {
        String entityStateFips = entity.primaryState().flatMap(StateCodes::fipsFor).orElse(null);
        Map<ProjectionRegion, Geometry> shapes = new EnumMap<>(ProjectionRegion.class);
        for (BoundaryFeature feature : features) {
            ProjectionRegion region = ProjectionRegion.forStateFips(
                    feature.stateFips() != null ? feature.stateFips() : entityStateFips);
            Geometry projected = repair(projections.get(region).project(feature.geometry()));
            shapes.merge(region, projected, Geometry::union);
        }
        if (shapes.size() > 1) {
            log.info("crosswalk.multiRegion entityId={} regions={}", entity.id(), shapes.keySet());
        }

        double entityArea = shapes.values().stream().mapToDouble(Geometry::getArea).sum();
        if (entityArea <= 0.0) {
            log.warn("crosswalk.zeroArea entityId={}", entity.id());
            return List.of();
        }

        Map<String, Double> weights = new TreeMap<>();
        Map<String, Double> areas = new HashMap<>();
        for (Map.Entry<ProjectionRegion, Geometry> regionShape : shapes.entrySet()) {
            ProjectionRegion region = regionShape.getKey();
            Geometry shape = regionShape.getValue();
            STRtree tree = countyIndex.get(region);
            if (tree == null) {
                log.warn("crosswalk.noCounties entityId={} region={}", entity.id(), region);
                continue;
            }
            @SuppressWarnings("unchecked")
            List<ProjectedCounty> candidates = tree.query(shape.getEnvelopeInternal());
            for (ProjectedCounty county : candidates) {
                double overlap;
                try {
                    overlap = shape.intersection(county.geometry()).getArea();
                } catch (TopologyException e) {
                    log.warn("crosswalk.topologyError entityId={} county={} error={}",
                            entity.id(), county.unitId(), e.getMessage());
                    continue;
                }
                if (overlap <= 0.0) {
                    continue;
                }
                double weight = overlap / entityArea;
                if (weight > 1.0) {
                    log.warn("crosswalk.weightClipped entityId={} county={} weight={}",
                            entity.id(), county.unitId(), weight);
                    weight = 1.0;
                }
                if (weight < options.getMinOverlap()) {
                    log.debug("crosswalk.sliver entityId={} county={} weight={}", entity.id(), county.unitId(), weight);
                    continue;
                }
                weights.put(county.unitId(), weight);
                areas.put(county.unitId(), overlap / SQ_M_PER_SQ_KM);
            }
        }

        if (weights.isEmpty()) {
            log.warn("crosswalk.noOverlap entityId={} regions={}", entity.id(), shapes.keySet());
            return List.of();
        }

        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        List<CrosswalkEntry> entries = new ArrayList<>(weights.size());
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            entries.add(new CrosswalkEntry(entity.id(), e.getKey(), Math.min(1.0, e.getValue() / sum),
                    CrosswalkMethod.AREA_WEIGHTED, areas.get(e.getKey())));
        }
        entries.sort(Comparator.comparingDouble(CrosswalkEntry::overlapWeight).reversed()
                .thenComparing(CrosswalkEntry::countyUnitId));
        return entries;
    }

    private Optional<CrosswalkEntry> fallback(CanonicalEntity entity) {
        return entity.primaryState()
                .flatMap(StateCodes::fipsFor)
                .map(fips -> {
                    log.info("crosswalk.fallback entityId={} stateUnit={}", entity.id(), fips);
                    return CrosswalkEntry.fallback(entity.id(), fips);
                });
    }

    private static ProjectionRegion regionOf(String stateFips, String unitId) {
        return ProjectionRegion.forStateFips(stateFips != null ? stateFips : StateCodes.stateFipsOf(unitId));
    }

    private static Geometry repair(Geometry geometry) {
        return geometry.isValid() ? geometry : geometry.buffer(0);
    }

    private record ProjectedCounty(String unitId, Geometry geometry) {}
}
