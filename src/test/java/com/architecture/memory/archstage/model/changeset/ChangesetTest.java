package com.architecture.memory.archstage.model.changeset;

import com.architecture.memory.archstage.exception.InvalidStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangesetTest {

    private Changeset changeset;

    @BeforeEach
    void setUp() {
        changeset = Changeset.create("cs-1", "c1", "test", "abc123");
    }

    @Test
    void appendAssignsGaplessSequenceNumbers_andRecomputesStats() {
        changeset.append(ChangeRecord.add("business.service.orders", "business", Map.of("name", "Orders")));
        changeset.append(ChangeRecord.update("business.service.billing", "business", Map.of(), Map.of("name", "Billing")));
        ChangeRecord last = changeset.append(ChangeRecord.delete("application.component.api", "application", Map.of()));

        assertThat(changeset.getChanges()).extracting(ChangeRecord::getSequenceNumber).containsExactly(0, 1, 2);
        assertThat(last.getSequenceNumber()).isEqualTo(2);
        assertThat(changeset.getStats().getAdditions()).isEqualTo(1);
        assertThat(changeset.getStats().getModifications()).isEqualTo(1);
        assertThat(changeset.getStats().getDeletions()).isEqualTo(1);
        assertThat(changeset.getAffectedLayers()).containsExactly("application", "business");
    }

    @Test
    void appendRejectsRecordThatAlreadyHasASequenceNumber() {
        ChangeRecord sequenced = ChangeRecord.add("x", "business", Map.of()).withSequenceNumber(7);

        assertThatThrownBy(() -> changeset.append(sequenced)).isInstanceOf(IllegalArgumentException.class);
        assertThat(changeset.getChanges()).isEmpty();
    }

    @Test
    void removeChangesForResequencesRemainingRecords() {
        changeset.append(ChangeRecord.add("a", "business", Map.of()));
        changeset.append(ChangeRecord.update("b", "business", Map.of(), Map.of()));
        changeset.append(ChangeRecord.update("a", "business", Map.of(), Map.of()));
        changeset.append(ChangeRecord.delete("c", "business", Map.of()));

        int removed = changeset.removeChangesFor("a");

        assertThat(removed).isEqualTo(2);
        assertThat(changeset.getChanges()).extracting(ChangeRecord::getElementId).containsExactly("b", "c");
        assertThat(changeset.getChanges()).extracting(ChangeRecord::getSequenceNumber).containsExactly(0, 1);
        assertThat(changeset.getStats().getAdditions()).isZero();
        assertThat(changeset.removeChangesFor("zzz")).isZero();
    }

    @Test
    void statusMachineGuardsTransitions() {
        assertThatThrownBy(changeset::markCommitted).isInstanceOf(InvalidStateException.class);

        changeset.markStaged();
        assertThatThrownBy(changeset::markStaged).isInstanceOf(InvalidStateException.class);

        changeset.markCommitted();
        assertThat(changeset.getStatus()).isEqualTo(ChangesetStatus.COMMITTED);
        assertThatThrownBy(changeset::markDiscarded).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> changeset.append(ChangeRecord.add("x", "business", Map.of())))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void discardClearsPendingChanges() {
        changeset.append(ChangeRecord.add("a", "business", Map.of()));

        changeset.markDiscarded();

        assertThat(changeset.getStatus()).isEqualTo(ChangesetStatus.DISCARDED);
        assertThat(changeset.getChanges()).isEmpty();
        assertThat(changeset.isActiveStatus()).isFalse();
    }

    @Test
    void restoreRejectsLogWithGaps() {
        ChangesetMetadata metadata = changeset.toMetadata();
        List<ChangeRecord> log = List.of(
                ChangeRecord.add("a", "business", Map.of()).withSequenceNumber(0),
                ChangeRecord.add("b", "business", Map.of()).withSequenceNumber(2));

        assertThatThrownBy(() -> Changeset.restore(metadata, log))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected sequence 1");
    }

    @Test
    void restoreOrdersLogAndRebuildsStats() {
        ChangesetMetadata metadata = changeset.toMetadata();
        List<ChangeRecord> log = List.of(
                ChangeRecord.delete("b", "business", Map.of()).withSequenceNumber(1),
                ChangeRecord.add("a", "business", Map.of()).withSequenceNumber(0));

        Changeset restored = Changeset.restore(metadata, log);

        assertThat(restored.getChanges()).extracting(ChangeRecord::getElementId).containsExactly("a", "b");
        assertThat(restored.getStats().getDeletions()).isEqualTo(1);
        assertThat(restored.getBaseSnapshot()).isEqualTo("abc123");
    }

    @Test
    void changeRecordValidatesTypeSpecificFields() {
        assertThatThrownBy(() -> ChangeRecord.add("a", "business", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChangeRecord.update("a", "business", Map.of(), null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChangeRecord(ChangeType.DELETE, "a", "business", -1, null, Map.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChangeRecord.add(" ", "business", Map.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChangeRecord.delete("a", null, Map.of())).isInstanceOf(IllegalArgumentException.class);

        assertThat(ChangeRecord.add("a", "business", Map.of()).isSequenced()).isFalse();
    }
}
