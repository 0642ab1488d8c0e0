package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.dto.MutationResult;
import com.architecture.memory.archstage.exception.ConflictException;
import com.architecture.memory.archstage.exception.NotFoundException;
import com.architecture.memory.archstage.exception.PersistenceException;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.changeset.ChangeType;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.support.FailingFileWriter;
import com.architecture.memory.archstage.support.StagingFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.architecture.memory.archstage.support.StagingFixture.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MutationHandlerTest {

    @TempDir
    Path root;

    private FailingFileWriter fileWriter;
    private StagingFixture fixture;
    private MutationHandler handler;
    private ArchitectureModel model;

    @BeforeEach
    void setUp() {
        fileWriter = new FailingFileWriter();
        fixture = new StagingFixture(fileWriter);
        handler = fixture.mutationHandler;
        model = fixture.seededModel(root);
    }

    // ========================= DIRECT WRITES =========================

    @Test
    void executeAdd_withoutActiveChangeset_persistsImmediately() {
        MutationResult result = handler.executeAdd(model, element(ORDERS, "business", "Orders", Map.of()),
                e -> e.getProperties().put("tier", "core"));

        assertThat(result.isStaged()).isFalse();
        assertThat(result.getChangeType()).isEqualTo(ChangeType.ADD);
        assertThat(result.getSequenceNumber()).isNull();
        assertThat(model.getElement(ORDERS).getProperties()).containsEntry("tier", "core");

        ArchitectureModel reloaded = fixture.modelRepository.load(root);
        assertThat(reloaded.getElement(ORDERS).getName()).isEqualTo("Orders");
    }

    @Test
    void executeUpdate_failedWrite_rollsBackInMemoryModel() {
        String before = fixture.snapshotManager.captureSnapshot(model);

        fileWriter.failOnMove(2);
        assertThatThrownBy(() -> handler.executeUpdate(model, BILLING, e -> e.setName("Broken")))
                .isInstanceOf(PersistenceException.class);
        fileWriter.disarm();

        assertThat(model.getElement(BILLING).getName()).isEqualTo("Billing");
        assertThat(fixture.snapshotManager.captureSnapshot(model)).isEqualTo(before);
        assertThat(fixture.modelRepository.load(root).getElement(BILLING).getName()).isEqualTo("Billing");
    }

    @Test
    void executeDelete_withoutActiveChangeset_cascadesRelationships() {
        handler.executeDelete(model, BILLING);

        assertThat(model.findElement(BILLING)).isEmpty();
        assertThat(model.getElement(API).getRelationships()).isEmpty();
        assertThat(fixture.modelRepository.load(root).findElement(BILLING)).isEmpty();
    }

    @Test
    void executeUpdate_rejectsIdOrLayerChange() {
        assertThatThrownBy(() -> handler.executeUpdate(model, BILLING, e -> e.setLayer("application")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> handler.executeUpdate(model, BILLING, e -> e.setId("business.service.other")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void executeUpdate_unknownElement_throwsNotFound() {
        assertThatThrownBy(() -> handler.executeUpdate(model, ORDERS, e -> e.setName("x")))
                .isInstanceOf(NotFoundException.class);
    }

    // ========================= STAGED WRITES =========================

    @Test
    void edits_withActiveChangeset_areStagedAndLeaveBaseAlone() {
        Changeset c1 = fixture.stagingAreaManager.create(model, "c1", null);
        fixture.stagingAreaManager.setActive(model, c1.getId());
        String before = fixture.snapshotManager.captureSnapshot(model);

        MutationResult added = handler.executeAdd(model, element(ORDERS, "business", "Orders", Map.of()), null);
        MutationResult updated = handler.executeUpdate(model, ORDERS, e -> e.setDescription("Order intake"));

        assertThat(added.isStaged()).isTrue();
        assertThat(added.getChangesetId()).isEqualTo(c1.getId());
        assertThat(added.getSequenceNumber()).isZero();
        assertThat(updated.getSequenceNumber()).isEqualTo(1);
        assertThat(model.getGraph().hasNode(ORDERS)).isFalse();
        assertThat(fixture.snapshotManager.captureSnapshot(model)).isEqualTo(before);

        ProjectedModel preview = fixture.stagingAreaManager.preview(model, c1.getId());
        assertThat(preview.getElement(ORDERS).orElseThrow().getDescription()).isEqualTo("Order intake");
    }

    @Test
    void mutatorRunsExactlyOnce() {
        Changeset c1 = fixture.stagingAreaManager.create(model, "c1", null);
        fixture.stagingAreaManager.setActive(model, c1.getId());
        AtomicInteger calls = new AtomicInteger();

        handler.executeUpdate(model, BILLING, e -> e.getProperties().put("calls", calls.incrementAndGet()));

        assertThat(calls).hasValue(1);
        ProjectedModel preview = fixture.stagingAreaManager.preview(model, c1.getId());
        assertThat(preview.getElement(BILLING).orElseThrow().getProperties()).containsEntry("calls", 1);
    }

    @Test
    void updateAfterStagedDelete_conflicts() {
        Changeset c1 = fixture.stagingAreaManager.create(model, "c1", null);
        fixture.stagingAreaManager.setActive(model, c1.getId());

        handler.executeDelete(model, PAYMENTS);

        assertThatThrownBy(() -> handler.executeUpdate(model, PAYMENTS, e -> e.setName("again")))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> handler.executeDelete(model, PAYMENTS))
                .isInstanceOf(ConflictException.class);
        assertThat(model.findElement(PAYMENTS)).isPresent();
    }

    @Test
    void edits_waitWhileStagingAreaManagerIsLocked() throws Exception {
        Changeset c1 = fixture.stagingAreaManager.create(model, "c1", null);
        fixture.stagingAreaManager.setActive(model, c1.getId());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<MutationResult> pending;
            synchronized (fixture.stagingAreaManager) {
                pending = executor.submit(() -> handler.executeUpdate(model, BILLING, e -> e.setName("Billing v2")));
                assertThatThrownBy(() -> pending.get(200, TimeUnit.MILLISECONDS))
                        .isInstanceOf(TimeoutException.class);
                assertThat(fixture.stagingAreaManager.load(model, c1.getId()).getChanges()).isEmpty();
            }

            MutationResult result = pending.get(5, TimeUnit.SECONDS);
            assertThat(result.isStaged()).isTrue();
            assertThat(result.getSequenceNumber()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }
}
