package com.architecture.memory.archstage.model;

import com.architecture.memory.archstage.model.graph.ElementReference;
import com.architecture.memory.archstage.model.graph.GraphValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between {@link Element} views and the plain map states recorded as the
 * before/after of a change, plus the merge rule an update state follows.
 *
 * Update merge rule:
 * <ul>
 *   <li>{@code name}, {@code type}, {@code description}: replaced when the key is present</li>
 *   <li>{@code properties}: merged key by key; a {@code null} value removes the key</li>
 *   <li>{@code references}, {@code relationships}: replaced wholesale when present</li>
 *   <li>{@code id} and {@code layer} never change</li>
 * </ul>
 */
public final class ElementStates {

    public static final String ID = "id";
    public static final String LAYER = "layer";
    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String PROPERTIES = "properties";
    public static final String REFERENCES = "references";
    public static final String RELATIONSHIPS = "relationships";

    private ElementStates() {
    }

    public static Map<String, Object> toState(Element element) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put(ID, element.getId());
        state.put(LAYER, element.getLayer());
        state.put(TYPE, element.getType());
        state.put(NAME, element.getName());
        state.put(DESCRIPTION, element.getDescription());
        state.put(PROPERTIES, GraphValues.copyMap(element.getProperties()));

        List<Object> refs = new ArrayList<>();
        if (element.getReferences() != null) {
            for (ElementReference ref : element.getReferences()) {
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("type", ref.getType());
                r.put("target", ref.getTarget());
                refs.add(r);
            }
        }
        state.put(REFERENCES, refs);

        List<Object> rels = new ArrayList<>();
        if (element.getRelationships() != null) {
            for (ElementRelationship rel : element.getRelationships()) {
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("predicate", rel.getPredicate());
                r.put("target", rel.getTarget());
                r.put("properties", GraphValues.copyMap(rel.getProperties()));
                rels.add(r);
            }
        }
        state.put(RELATIONSHIPS, rels);
        return state;
    }

    /**
     * Build an element from a full state. Missing name falls back to the id,
     * missing type to {@code unknown}.
     */
    public static Element toElement(String id, String layer, Map<String, Object> state) {
        Element element = Element.builder()
                .id(id)
                .layer(layer)
                .type("unknown")
                .name(id)
                .build();
        if (state == null) {
            return element;
        }
        if (state.get(TYPE) instanceof String type) {
            element.setType(type);
        }
        if (state.get(NAME) instanceof String name) {
            element.setName(name);
        }
        if (state.get(DESCRIPTION) instanceof String description) {
            element.setDescription(description);
        }
        element.setProperties(readProperties(state.get(PROPERTIES), false));
        element.setReferences(readReferences(state.get(REFERENCES)));
        element.setRelationships(readRelationships(state.get(RELATIONSHIPS)));
        return element;
    }

    /**
     * Apply an update state to a base element and return the merged copy.
     */
    public static Element merge(Element base, Map<String, Object> patch) {
        Element merged = base.copy();
        if (patch == null) {
            return merged;
        }
        if (patch.containsKey(NAME) && patch.get(NAME) instanceof String name) {
            merged.setName(name);
        }
        if (patch.containsKey(TYPE) && patch.get(TYPE) instanceof String type) {
            merged.setType(type);
        }
        if (patch.containsKey(DESCRIPTION)) {
            Object description = patch.get(DESCRIPTION);
            merged.setDescription(description == null ? null : String.valueOf(description));
        }
        if (patch.get(PROPERTIES) instanceof Map<?, ?>) {
            Map<String, Object> props = merged.getProperties();
            readProperties(patch.get(PROPERTIES), true).forEach((key, value) -> {
                if (value == null) {
                    props.remove(key);
                } else {
                    props.put(key, value);
                }
            });
        }
        if (patch.get(REFERENCES) instanceof List<?>) {
            merged.setReferences(readReferences(patch.get(REFERENCES)));
        }
        if (patch.get(RELATIONSHIPS) instanceof List<?>) {
            merged.setRelationships(readRelationships(patch.get(RELATIONSHIPS)));
        }
        return merged;
    }

    /**
     * Build the update state that turns {@code before} into {@code after}: a full state
     * whose properties map carries explicit {@code null}s for removed keys.
     */
    public static Map<String, Object> updateState(Element before, Element after) {
        Map<String, Object> state = toState(after);
        @SuppressWarnings("unchecked")
        Map<String, Object> props = (Map<String, Object>) state.get(PROPERTIES);
        if (before.getProperties() != null) {
            for (String key : before.getProperties().keySet()) {
                if (!props.containsKey(key)) {
                    props.put(key, null);
                }
            }
        }
        return state;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readProperties(Object value, boolean keepNulls) {
        Map<String, Object> props = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() == null && !keepNulls) {
                    continue;
                }
                props.put(String.valueOf(entry.getKey()), GraphValues.deepCopy(entry.getValue()));
            }
        }
        return props;
    }

    private static List<ElementReference> readReferences(Object value) {
        List<ElementReference> refs = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof ElementReference ref) {
                    refs.add(ref.copy());
                } else if (item instanceof Map<?, ?> map) {
                    refs.add(new ElementReference(asString(map.get("type")), asString(map.get("target"))));
                }
            }
        }
        return refs;
    }

    @SuppressWarnings("unchecked")
    private static List<ElementRelationship> readRelationships(Object value) {
        List<ElementRelationship> rels = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof ElementRelationship rel) {
                    rels.add(ElementRelationship.builder()
                            .predicate(rel.getPredicate())
                            .target(rel.getTarget())
                            .properties(GraphValues.copyMap(rel.getProperties()))
                            .build());
                } else if (item instanceof Map<?, ?> map) {
                    Object props = map.get("properties");
                    rels.add(ElementRelationship.builder()
                            .predicate(asString(map.get("predicate")))
                            .target(asString(map.get("target")))
                            .properties(props instanceof Map<?, ?>
                                    ? GraphValues.copyMap((Map<String, Object>) props)
                                    : new LinkedHashMap<>())
                            .build());
                }
            }
        }
        return rels;
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
