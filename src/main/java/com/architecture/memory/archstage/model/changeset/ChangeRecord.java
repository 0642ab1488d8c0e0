package com.architecture.memory.archstage.model.changeset;

import com.architecture.memory.archstage.model.graph.GraphValues;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * One staged delta against a single element.
 *
 * Type-specific fields are checked at construction: ADD and UPDATE need an {@code after}
 * state, DELETE must not carry one. Records built through the factories are unsequenced
 * ({@link #UNSEQUENCED}); only {@link Changeset#append(ChangeRecord)} assigns a number.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeRecord {

    public static final int UNSEQUENCED = -1;

    private final ChangeType type;
    private final String elementId;
    private final String layerName;
    private final int sequenceNumber;
    private final Map<String, Object> before;
    private final Map<String, Object> after;
    private final LocalDateTime timestamp;

    @JsonCreator
    ChangeRecord(@JsonProperty("type") ChangeType type,
                 @JsonProperty("elementId") String elementId,
                 @JsonProperty("layerName") String layerName,
                 @JsonProperty("sequenceNumber") int sequenceNumber,
                 @JsonProperty("before") Map<String, Object> before,
                 @JsonProperty("after") Map<String, Object> after,
                 @JsonProperty("timestamp") LocalDateTime timestamp) {
        this.type = Objects.requireNonNull(type, "change type");
        if (elementId == null || elementId.isBlank()) {
            throw new IllegalArgumentException("Change record requires an element id");
        }
        if (layerName == null || layerName.isBlank()) {
            throw new IllegalArgumentException("Change record for " + elementId + " requires a layer name");
        }
        switch (type) {
            case ADD, UPDATE -> {
                if (after == null) {
                    throw new IllegalArgumentException(type + " change for " + elementId + " requires an after state");
                }
            }
            case DELETE -> {
                if (after != null) {
                    throw new IllegalArgumentException("DELETE change for " + elementId + " cannot carry an after state");
                }
            }
        }
        this.elementId = elementId;
        this.layerName = layerName;
        this.sequenceNumber = sequenceNumber;
        this.before = before == null ? null : Collections.unmodifiableMap(GraphValues.copyMap(before));
        this.after = after == null ? null : Collections.unmodifiableMap(GraphValues.copyMap(after));
        this.timestamp = timestamp != null ? timestamp : LocalDateTime.now();
    }

    public static ChangeRecord add(String elementId, String layerName, Map<String, Object> after) {
        return new ChangeRecord(ChangeType.ADD, elementId, layerName, UNSEQUENCED, null, after, null);
    }

    public static ChangeRecord update(String elementId, String layerName,
                                      Map<String, Object> before, Map<String, Object> after) {
        return new ChangeRecord(ChangeType.UPDATE, elementId, layerName, UNSEQUENCED, before, after, null);
    }

    public static ChangeRecord delete(String elementId, String layerName, Map<String, Object> before) {
        return new ChangeRecord(ChangeType.DELETE, elementId, layerName, UNSEQUENCED, before, null, null);
    }

    @JsonIgnore
    public boolean isSequenced() {
        return sequenceNumber >= 0;
    }

    ChangeRecord withSequenceNumber(int number) {
        return new ChangeRecord(type, elementId, layerName, number, before, after, timestamp);
    }
}
