package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.config.ArchStageProperties;
import com.architecture.memory.archstage.dto.*;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.Element;
import com.architecture.memory.archstage.model.ElementStates;
import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.model.graph.GraphModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes the model a change log would produce without touching the base model.
 *
 * Projections of a changeset are cached per changeset id for the configured TTL. A cached
 * projection is dropped as soon as the base graph, its version, or the changeset's log changes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VirtualProjectionEngine {

    private final ChangeMerger changeMerger;
    private final ArchStageProperties properties;

    private final Map<String, CachedProjection> cache = new ConcurrentHashMap<>();

    private record CachedProjection(ProjectedModel projection, GraphModel baseGraph, long baseVersion,
                                    int changeCount, LocalDateTime changesetModified, Instant computedAt) {
    }

    // ========================= PROJECTION =========================

    public ProjectedModel projectChanges(ArchitectureModel base, List<ChangeRecord> records) {
        return project(base, null, records);
    }

    public ProjectedModel projectChangeset(ArchitectureModel base, Changeset changeset) {
        CachedProjection cached = cache.get(changeset.getId());
        if (cached != null && isFresh(cached, base, changeset)) {
            log.debug("Projection cache hit for changeset {}", changeset.getId());
            return cached.projection();
        }
        ProjectedModel projection = project(base, changeset.getId(), changeset.getChanges());
        cache.put(changeset.getId(), new CachedProjection(projection, base.getGraph(), base.getGraph().getVersion(),
                changeset.getChangeCount(), changeset.getModified(), Instant.now()));
        return projection;
    }

    public Optional<Element> projectElement(ArchitectureModel base, Changeset changeset, String elementId) {
        return projectChangeset(base, changeset).getElement(elementId);
    }

    public List<Element> projectLayer(ArchitectureModel base, Changeset changeset, String layer) {
        return projectChangeset(base, changeset).getLayerElements(layer);
    }

    public void invalidate(String changesetId) {
        if (cache.remove(changesetId) != null) {
            log.debug("Invalidated projection cache for changeset {}", changesetId);
        }
    }

    private ProjectedModel project(ArchitectureModel base, String changesetId, List<ChangeRecord> records) {
        ArchitectureModel copy = ChangeMerger.copyOf(base);
        ChangeMerger.MergeResult result = changeMerger.apply(copy, records);
        log.debug("Projected {} change(s) onto model at {}", records.size(), base.getRootPath());
        return new ProjectedModel(copy, changesetId, result);
    }

    private boolean isFresh(CachedProjection cached, ArchitectureModel base, Changeset changeset) {
        return cached.baseGraph() == base.getGraph()
                && cached.baseVersion() == base.getGraph().getVersion()
                && cached.changeCount() == changeset.getChangeCount()
                && Objects.equals(cached.changesetModified(), changeset.getModified())
                && cached.computedAt().plus(properties.getProjectionCacheTtl()).isAfter(Instant.now());
    }

    // ========================= DIFF =========================

    public ChangesetDiff computeDiff(ArchitectureModel base, Changeset changeset) {
        ProjectedModel projected = projectChangeset(base, changeset);

        Map<String, Element> before = new LinkedHashMap<>();
        for (String layer : base.getLayerNames()) {
            base.getLayer(layer).listElements().forEach(e -> before.put(e.getId(), e));
        }
        Map<String, Element> after = new LinkedHashMap<>();
        projected.getElements().forEach(e -> after.put(e.getId(), e));

        ChangesetDiff diff = ChangesetDiff.builder()
                .changesetId(changeset.getId())
                .changesetName(changeset.getName())
                .baseSnapshot(changeset.getBaseSnapshot())
                .computedAt(LocalDateTime.now())
                .build();

        for (Element element : after.values()) {
            Element previous = before.get(element.getId());
            if (previous == null) {
                diff.getAdditions().add(change(ElementChange.ChangeKind.ADDED, element, null, ElementStates.toState(element)));
                continue;
            }
            Map<String, Object> oldState = ElementStates.toState(previous);
            Map<String, Object> newState = ElementStates.toState(element);
            List<PropertyDiff> diffs = diffStates(oldState, newState);
            if (!diffs.isEmpty()) {
                ElementChange change = change(ElementChange.ChangeKind.MODIFIED, element, oldState, newState);
                change.setPropertyDiffs(diffs);
                diff.getModifications().add(change);
            }
        }
        for (Element element : before.values()) {
            if (!after.containsKey(element.getId())) {
                diff.getDeletions().add(change(ElementChange.ChangeKind.REMOVED, element, ElementStates.toState(element), null));
            }
        }

        Map<String, GraphEdge> baseEdges = new HashMap<>();
        base.getGraph().getEdges().forEach(e -> baseEdges.put(e.getId(), e));
        Map<String, GraphEdge> projectedEdges = new HashMap<>();
        projected.getRelationships().forEach(e -> projectedEdges.put(e.getId(), e));
        projectedEdges.values().stream()
                .filter(e -> !baseEdges.containsKey(e.getId()))
                .sorted(Comparator.comparing(GraphEdge::getId))
                .forEach(e -> diff.getRelationshipChanges().add(relationshipChange(RelationshipChange.ChangeKind.ADDED, e)));
        baseEdges.values().stream()
                .filter(e -> !projectedEdges.containsKey(e.getId()))
                .sorted(Comparator.comparing(GraphEdge::getId))
                .forEach(e -> diff.getRelationshipChanges().add(relationshipChange(RelationshipChange.ChangeKind.REMOVED, e)));

        diff.setSummary(summarize(diff));
        return diff;
    }

    /**
     * Field-level differences between two element states. Properties are compared key by key
     * and reported as {@code properties.<key>}.
     */
    @SuppressWarnings("unchecked")
    static List<PropertyDiff> diffStates(Map<String, Object> oldState, Map<String, Object> newState) {
        List<PropertyDiff> diffs = new ArrayList<>();
        Set<String> keys = new TreeSet<>(oldState.keySet());
        keys.addAll(newState.keySet());
        for (String key : keys) {
            Object oldValue = oldState.get(key);
            Object newValue = newState.get(key);
            if (ElementStates.PROPERTIES.equals(key) && oldValue instanceof Map<?, ?> && newValue instanceof Map<?, ?>) {
                Map<String, Object> oldProps = (Map<String, Object>) oldValue;
                Map<String, Object> newProps = (Map<String, Object>) newValue;
                Set<String> propKeys = new TreeSet<>(oldProps.keySet());
                propKeys.addAll(newProps.keySet());
                for (String prop : propKeys) {
                    if (!Objects.equals(oldProps.get(prop), newProps.get(prop))) {
                        diffs.add(new PropertyDiff(key + "." + prop, oldProps.get(prop), newProps.get(prop)));
                    }
                }
            } else if (!Objects.equals(oldValue, newValue)) {
                diffs.add(new PropertyDiff(key, oldValue, newValue));
            }
        }
        return diffs;
    }

    private static ElementChange change(ElementChange.ChangeKind kind, Element element,
                                        Map<String, Object> baseState, Map<String, Object> projectedState) {
        return ElementChange.builder()
                .changeKind(kind)
                .elementId(element.getId())
                .layerName(element.getLayer())
                .elementType(element.getType())
                .displayName(element.getName())
                .baseState(baseState)
                .projectedState(projectedState)
                .build();
    }

    private static RelationshipChange relationshipChange(RelationshipChange.ChangeKind kind, GraphEdge edge) {
        return RelationshipChange.builder()
                .changeKind(kind)
                .relationshipId(edge.getId())
                .predicate(edge.getPredicate())
                .sourceId(edge.getSource())
                .destinationId(edge.getDestination())
                .build();
    }

    private static DiffSummary summarize(ChangesetDiff diff) {
        Map<String, Integer> byLayer = new TreeMap<>();
        List<ElementChange> all = new ArrayList<>(diff.getAdditions());
        all.addAll(diff.getModifications());
        all.addAll(diff.getDeletions());
        all.forEach(c -> byLayer.merge(c.getLayerName(), 1, Integer::sum));

        int relationshipsAdded = (int) diff.getRelationshipChanges().stream()
                .filter(r -> r.getChangeKind() == RelationshipChange.ChangeKind.ADDED).count();
        int relationshipsRemoved = diff.getRelationshipChanges().size() - relationshipsAdded;

        return DiffSummary.builder()
                .totalChanges(all.size() + diff.getRelationshipChanges().size())
                .elementsAdded(diff.getAdditions().size())
                .elementsModified(diff.getModifications().size())
                .elementsRemoved(diff.getDeletions().size())
                .relationshipsAdded(relationshipsAdded)
                .relationshipsRemoved(relationshipsRemoved)
                .changesByLayer(byLayer)
                .build();
    }
}
