package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.dto.CommitOptions;
import com.architecture.memory.archstage.dto.CommitResult;
import com.architecture.memory.archstage.dto.DriftReport;
import com.architecture.memory.archstage.exception.*;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.Element;
import com.architecture.memory.archstage.model.ElementStates;
import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.model.changeset.ChangesetStatus;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.model.graph.ElementReference;
import com.architecture.memory.archstage.repository.ChangesetRepository;
import com.architecture.memory.archstage.support.FailingFileWriter;
import com.architecture.memory.archstage.support.StagingFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

import static com.architecture.memory.archstage.support.StagingFixture.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StagingAreaManagerTest {

    @TempDir
    Path root;

    private FailingFileWriter fileWriter;
    private StagingFixture fixture;
    private StagingAreaManager manager;
    private ArchitectureModel model;

    @BeforeEach
    void setUp() {
        fileWriter = new FailingFileWriter();
        fixture = new StagingFixture(fileWriter);
        manager = fixture.stagingAreaManager;
        model = fixture.seededModel(root);
    }

    // ========================= SCENARIOS =========================

    @Test
    void scenarioA_stagePreviewAndCommit() {
        Changeset c1 = manager.create(model, "c1", "add orders, rename billing");
        String h0 = c1.getBaseSnapshot();
        assertThat(h0).isEqualTo(fixture.snapshotManager.captureSnapshot(model));

        manager.stage(model, c1.getId(), ChangeRecord.add(ORDERS, "business",
                ElementStates.toState(element(ORDERS, "business", "Orders", Map.of()))));
        manager.stage(model, c1.getId(), ChangeRecord.update(BILLING, "business",
                ElementStates.toState(model.getElement(BILLING)), Map.of("name", "Billing Service")));

        ProjectedModel preview = manager.preview(model, "c1");
        assertThat(preview.hasElement(ORDERS)).isTrue();
        assertThat(preview.getElement(BILLING).orElseThrow().getName()).isEqualTo("Billing Service");
        assertThat(model.getGraph().hasNode(ORDERS)).isFalse();
        assertThat(model.getElement(BILLING).getName()).isEqualTo("Billing");
        assertThat(fixture.snapshotManager.captureSnapshot(model)).isEqualTo(h0);

        CommitResult result = manager.commit(model, "c1", CommitOptions.defaults());

        assertThat(result.getNewSnapshot()).isNotEqualTo(h0);
        assertThat(result.getAdditions()).isEqualTo(1);
        assertThat(result.getModifications()).isEqualTo(1);
        assertThat(manager.load(model, "c1").getStatus()).isEqualTo(ChangesetStatus.COMMITTED);
        assertThat(model.getElement(BILLING).getName()).isEqualTo("Billing Service");
        assertThat(model.getManifest().getChangesetHistory())
                .singleElement()
                .satisfies(entry -> assertThat(entry.getChangesetId()).isEqualTo(c1.getId()));

        assertThatThrownBy(() -> manager.commit(model, "c1", CommitOptions.defaults()))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void scenarioB_updateAfterDeleteInSameChangesetConflicts() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.stage(model, c1.getId(), ChangeRecord.delete(PAYMENTS, "business",
                ElementStates.toState(model.getElement(PAYMENTS))));

        assertThatThrownBy(() -> manager.stage(model, c1.getId(),
                ChangeRecord.update(PAYMENTS, "business", Map.of(), Map.of("name", "Payments v2"))))
                .isInstanceOf(ConflictException.class);

        assertThat(manager.load(model, c1.getId()).getChanges()).hasSize(1);
    }

    @Test
    void unstage_rejectsRemovalThatLaterChangesDependOn() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.stage(model, c1.getId(), ChangeRecord.add(ORDERS, "business",
                ElementStates.toState(element(ORDERS, "business", "Orders", Map.of()))));
        manager.stage(model, c1.getId(), ChangeRecord.update(API, "application", Map.of(),
                Map.of("relationships", List.of(Map.of("predicate", "serves", "target", ORDERS)))));

        assertThatThrownBy(() -> manager.unstage(model, c1.getId(), ORDERS))
                .isInstanceOfSatisfying(ConflictException.class, e -> assertThat(e.getMessage()).contains(API));

        assertThat(manager.load(model, c1.getId()).getChanges())
                .extracting(ChangeRecord::getElementId).containsExactly(ORDERS, API);
        assertThat(manager.preview(model, "c1").hasElement(ORDERS)).isTrue();
    }

    @Test
    void scenarioC_secondChangesetFromSameBaseDrifts() {
        Changeset c1 = manager.create(model, "c1", null);
        Changeset c2 = manager.create(model, "c2", null);
        assertThat(c2.getBaseSnapshot()).isEqualTo(c1.getBaseSnapshot());

        manager.stage(model, c1.getId(), ChangeRecord.update(BILLING, "business", Map.of(), Map.of("name", "Billing v2")));
        manager.stage(model, c2.getId(), ChangeRecord.add(ORDERS, "business", Map.of("name", "Orders")));

        CommitResult first = manager.commit(model, c1.getId(), CommitOptions.defaults());
        assertThat(first.getNewSnapshot()).isNotEqualTo(c1.getBaseSnapshot());

        assertThatThrownBy(() -> manager.commit(model, c2.getId(), CommitOptions.defaults()))
                .isInstanceOfSatisfying(DriftException.class, e -> {
                    assertThat(e.getReport().getAffectedLayers()).contains("business");
                    assertThat(e.getReport().getAffectedElementIds()).containsExactly(BILLING);
                    assertThat(e.getMessage()).contains("c2").contains(BILLING);
                });
        assertThat(manager.load(model, c2.getId()).getStatus()).isEqualTo(ChangesetStatus.STAGED);
    }

    // ========================= PROPERTIES =========================

    @Test
    void projectionEqualsModelAfterCommit() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.stage(model, c1.getId(), ChangeRecord.add(ORDERS, "business", Map.of(
                "name", "Orders",
                "type", "service",
                "relationships", List.of(Map.of("predicate", "uses", "target", PAYMENTS)))));
        manager.stage(model, c1.getId(), ChangeRecord.delete(BILLING, "business", Map.of()));
        manager.stage(model, c1.getId(), ChangeRecord.update(API, "application", Map.of(),
                Map.of("properties", Map.of("protocol", "https"))));
        Changeset staged = manager.load(model, c1.getId());

        ProjectedModel projected = fixture.projectionEngine.projectChanges(model, staged.getChanges());
        manager.commit(model, c1.getId(), CommitOptions.builder().skipValidation(true).build());

        assertThat(states(projected.getElements())).isEqualTo(states(liveElements()));
        assertThat(projected.getRelationships()).extracting(GraphEdge::getId)
                .containsExactlyInAnyOrderElementsOf(model.getGraph().getEdges().stream().map(GraphEdge::getId).toList());
    }

    @Test
    void sequenceNumbersAreAssignedByStagingOnly() {
        Changeset c1 = manager.create(model, "c1", null);
        ChangeRecord unsequenced = ChangeRecord.update(BILLING, "business", Map.of(), Map.of("name", "a"));
        assertThat(unsequenced.getSequenceNumber()).isEqualTo(ChangeRecord.UNSEQUENCED);

        ChangeRecord first = manager.stage(model, c1.getId(), unsequenced);
        ChangeRecord second = manager.stage(model, c1.getId(), ChangeRecord.update(PAYMENTS, "business", Map.of(), Map.of("name", "b")));

        assertThat(first.getSequenceNumber()).isZero();
        assertThat(second.getSequenceNumber()).isEqualTo(1);
        assertThatThrownBy(() -> manager.stage(model, c1.getId(), first)).isInstanceOf(IllegalArgumentException.class);
        assertThat(manager.load(model, c1.getId()).getChanges())
                .extracting(ChangeRecord::getSequenceNumber).containsExactly(0, 1);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6})
    void failedWriteDuringCommitLeavesModelAndChangesetUntouched(int failingWrite) throws IOException {
        Changeset c1 = stageTwoLayerChangeset();
        String before = fixture.snapshotManager.captureSnapshot(model);
        Map<Path, byte[]> filesBefore = readModelFiles();

        fileWriter.failOnWrite(failingWrite);
        assertThatThrownBy(() -> manager.commit(model, c1.getId(), CommitOptions.defaults()))
                .isInstanceOf(PersistenceException.class);
        fileWriter.disarm();

        assertCommitRolledBack(c1, before, filesBefore);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 8, 11})
    void failedMoveDuringCommitRestoresPreviousFiles(int failingMove) throws IOException {
        Changeset c1 = stageTwoLayerChangeset();
        String before = fixture.snapshotManager.captureSnapshot(model);
        Map<Path, byte[]> filesBefore = readModelFiles();

        fileWriter.failOnMove(failingMove);
        assertThatThrownBy(() -> manager.commit(model, c1.getId(), CommitOptions.defaults()))
                .isInstanceOf(PersistenceException.class);
        fileWriter.disarm();

        assertCommitRolledBack(c1, before, filesBefore);
    }

    @Test
    void commitWritesEveryDocumentThroughOneAtomicUnit() {
        Changeset c1 = stageTwoLayerChangeset();

        fileWriter.disarm();
        manager.commit(model, c1.getId(), CommitOptions.defaults());

        // business + application layers, relationships, manifest, changeset metadata and log
        assertThat(fileWriter.getWrites()).isEqualTo(6);
    }

    @Test
    void baseMutationAfterCreateBlocksCommit_unlessDriftCheckSkipped() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.stage(model, c1.getId(), ChangeRecord.add(ORDERS, "business", Map.of("name", "Orders")));

        fixture.mutationHandler.executeUpdate(model, PAYMENTS, e -> e.setDescription("changed outside staging"));

        DriftReport drift = manager.detectDrift(model, c1.getId());
        assertThat(drift.isDrifted()).isTrue();
        assertThat(drift.getAffectedElementIds()).containsExactly(PAYMENTS);

        assertThatThrownBy(() -> manager.commit(model, c1.getId(), CommitOptions.defaults()))
                .isInstanceOf(DriftException.class);

        CommitResult result = manager.commit(model, c1.getId(), CommitOptions.builder().skipDriftCheck(true).build());
        assertThat(result.getAdditions()).isEqualTo(1);
        assertThat(model.getGraph().hasNode(ORDERS)).isTrue();
    }

    // ========================= LIFECYCLE =========================

    @Test
    void createRejectsDuplicateName() {
        manager.create(model, "c1", null);

        assertThatThrownBy(() -> manager.create(model, "c1", null)).isInstanceOf(ConflictException.class);
        assertThat(manager.list(model)).hasSize(1);
    }

    @Test
    void createPersistsMetadataChangesAndBaseState() {
        Changeset c1 = manager.create(model, "c1", "desc");

        Path dir = ChangesetRepository.changesetDir(root, c1.getId());
        assertThat(dir.resolve("metadata.yaml")).exists();
        assertThat(dir.resolve("changes.yaml")).exists();
        assertThat(dir.resolve("base-state.yaml")).exists();
        assertThat(manager.load(model, "c1").getStatus()).isEqualTo(ChangesetStatus.DRAFT);
    }

    @Test
    void activatingDraftMarksItStaged_andPointerPersists() {
        Changeset c1 = manager.create(model, "c1", null);

        manager.setActive(model, "c1");

        assertThat(Files.exists(ChangesetRepository.activePath(root))).isTrue();
        assertThat(manager.getActive(model)).get().extracting(Changeset::getId).isEqualTo(c1.getId());
        assertThat(manager.load(model, c1.getId()).getStatus()).isEqualTo(ChangesetStatus.STAGED);

        manager.clearActive(model);
        assertThat(manager.getActive(model)).isEmpty();
    }

    @Test
    void activatingFinishedChangesetFails() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.discard(model, c1.getId());

        assertThatThrownBy(() -> manager.setActive(model, c1.getId())).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void stageUsesActiveChangeset_andFailsWithoutOne() {
        ChangeRecord record = ChangeRecord.update(BILLING, "business", Map.of(), Map.of("name", "x"));
        assertThatThrownBy(() -> manager.stage(model, record)).isInstanceOf(InvalidStateException.class);

        Changeset c1 = manager.create(model, "c1", null);
        manager.setActive(model, c1.getId());
        manager.stage(model, record);

        assertThat(manager.load(model, c1.getId()).getChangeCount()).isEqualTo(1);
    }

    @Test
    void stageRejectsTerminalChangeset_andUnresolvableRecords() {
        Changeset c1 = manager.create(model, "c1", null);

        assertThatThrownBy(() -> manager.stage(model, c1.getId(),
                ChangeRecord.update(ORDERS, "business", Map.of(), Map.of("name", "x"))))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.stage(model, c1.getId(), ChangeRecord.add(BILLING, "business", Map.of())))
                .isInstanceOf(ConflictException.class);

        manager.discard(model, c1.getId());
        assertThatThrownBy(() -> manager.stage(model, c1.getId(),
                ChangeRecord.update(BILLING, "business", Map.of(), Map.of("name", "x"))))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void unstageRemovesRecordsAndResequences() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.setActive(model, c1.getId());
        manager.stage(model, ChangeRecord.update(BILLING, "business", Map.of(), Map.of("name", "a")));
        manager.stage(model, ChangeRecord.update(PAYMENTS, "business", Map.of(), Map.of("name", "b")));
        manager.stage(model, ChangeRecord.update(BILLING, "business", Map.of(), Map.of("name", "c")));

        Changeset after = manager.unstage(model, BILLING);

        assertThat(after.getChanges()).extracting(ChangeRecord::getElementId).containsExactly(PAYMENTS);
        assertThat(after.getChanges().get(0).getSequenceNumber()).isZero();
        assertThat(after.getStats().getModifications()).isEqualTo(1);
        assertThatThrownBy(() -> manager.unstage(model, BILLING)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void discardLeavesBaseUntouched_andClearsPointer() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.setActive(model, c1.getId());
        manager.stage(model, ChangeRecord.delete(BILLING, "business", Map.of()));
        String before = fixture.snapshotManager.captureSnapshot(model);

        Changeset discarded = manager.discard(model, "c1");

        assertThat(discarded.getStatus()).isEqualTo(ChangesetStatus.DISCARDED);
        assertThat(fixture.snapshotManager.captureSnapshot(model)).isEqualTo(before);
        assertThat(manager.getActive(model)).isEmpty();
        assertThat(Files.exists(ChangesetRepository.activePath(root))).isFalse();
        assertThatThrownBy(() -> manager.commit(model, "c1", CommitOptions.defaults()))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void commitOfDraftFails() {
        manager.create(model, "c1", null);

        assertThatThrownBy(() -> manager.commit(model, "c1", CommitOptions.defaults()))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("DRAFT");
    }

    @Test
    void commitClearsActivePointer() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.setActive(model, c1.getId());
        manager.stage(model, ChangeRecord.update(BILLING, "business", Map.of(), Map.of("name", "x")));

        manager.commit(model, c1.getId(), CommitOptions.defaults());

        assertThat(manager.getActive(model)).isEmpty();
    }

    @Test
    void validationErrorsBlockCommit_unlessSkipped() {
        Changeset c1 = manager.create(model, "c1", null);
        Element orders = element(ORDERS, "business", "Orders", Map.of());
        orders.setReferences(new ArrayList<>(List.of(new ElementReference("realizes", "business.service.ghost"))));
        manager.stage(model, c1.getId(), ChangeRecord.add(ORDERS, "business", ElementStates.toState(orders)));

        assertThatThrownBy(() -> manager.commit(model, c1.getId(), CommitOptions.defaults()))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getViolations()).singleElement()
                                .satisfies(f -> assertThat(f.getElementId()).isEqualTo(ORDERS)));
        assertThat(model.getGraph().hasNode(ORDERS)).isFalse();

        manager.commit(model, c1.getId(), CommitOptions.builder().skipValidation(true).build());
        assertThat(model.getGraph().hasNode(ORDERS)).isTrue();
    }

    @Test
    void dryRunReportsCountsWithoutWriting() throws IOException {
        Changeset c1 = stageTwoLayerChangeset();
        Map<Path, byte[]> filesBefore = readModelFiles();
        String before = fixture.snapshotManager.captureSnapshot(model);

        CommitResult result = manager.commit(model, c1.getId(), CommitOptions.builder().dryRun(true).build());

        assertThat(result.isDryRun()).isTrue();
        assertThat(result.getAdditions() + result.getModifications() + result.getDeletions()).isEqualTo(2);
        assertThat(result.getAffectedLayers()).containsExactly("application", "business");
        assertThat(result.getNewSnapshot()).isNull();
        assertThat(fixture.snapshotManager.captureSnapshot(model)).isEqualTo(before);
        assertModelFilesEqual(filesBefore);
        assertThat(manager.load(model, c1.getId()).getStatus()).isEqualTo(ChangesetStatus.STAGED);
    }

    @Test
    void deleteRefusesActiveChangeset() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.setActive(model, c1.getId());

        assertThatThrownBy(() -> manager.delete(model, "c1")).isInstanceOf(InvalidStateException.class);

        manager.clearActive(model);
        manager.delete(model, "c1");
        assertThat(manager.find(model, "c1")).isEmpty();
    }

    @Test
    void staleActivePointerIsCleared() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.setActive(model, c1.getId());
        fixture.changesetRepository.delete(root, c1.getId());

        assertThat(manager.getActive(model)).isEmpty();
        assertThat(Files.exists(ChangesetRepository.activePath(root))).isFalse();
    }

    @Test
    void purgeDiscardedRespectsRetention() {
        Changeset c1 = manager.create(model, "c1", null);
        manager.create(model, "c2", null);
        manager.discard(model, c1.getId());

        assertThat(manager.purgeDiscarded(model, Duration.ofDays(7))).isZero();
        assertThat(manager.purgeDiscarded(model, Duration.ofSeconds(-1))).isEqualTo(1);
        assertThat(manager.list(model)).extracting(Changeset::getName).containsExactly("c2");
    }

    @Test
    void committedModelReloadsFromDisk() {
        Changeset c1 = stageTwoLayerChangeset();
        manager.commit(model, c1.getId(), CommitOptions.defaults());

        ArchitectureModel reloaded = fixture.modelRepository.load(root);

        assertThat(reloaded.getGraph().hasNode(ORDERS)).isTrue();
        assertThat(reloaded.getElement(API).getName()).isEqualTo("Gateway");
        assertThat(reloaded.getManifest().getChangesetHistory()).hasSize(1);
    }

    // ========================= HELPERS =========================

    private Changeset stageTwoLayerChangeset() {
        Changeset c1 = manager.create(model, "two-layers", null);
        manager.stage(model, c1.getId(), ChangeRecord.add(ORDERS, "business", Map.of("name", "Orders", "type", "service")));
        manager.stage(model, c1.getId(), ChangeRecord.update(API, "application", Map.of(), Map.of("name", "Gateway")));
        return manager.load(model, c1.getId());
    }

    private void assertCommitRolledBack(Changeset c1, String snapshotBefore, Map<Path, byte[]> filesBefore) throws IOException {
        assertThat(fixture.snapshotManager.captureSnapshot(model)).isEqualTo(snapshotBefore);
        assertThat(model.getGraph().hasNode(ORDERS)).isFalse();
        assertThat(model.getElement(API).getName()).isEqualTo("Public API");
        assertThat(manager.load(model, c1.getId()).getStatus()).isEqualTo(ChangesetStatus.STAGED);
        assertModelFilesEqual(filesBefore);
    }

    private Map<Path, byte[]> readModelFiles() throws IOException {
        Map<Path, byte[]> files = new TreeMap<>();
        List<Path> paths;
        try (var walk = Files.walk(root)) {
            paths = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        }
        for (Path path : paths) {
            files.put(root.relativize(path), Files.readAllBytes(path));
        }
        return files;
    }

    private void assertModelFilesEqual(Map<Path, byte[]> expected) throws IOException {
        Map<Path, byte[]> actual = readModelFiles();
        assertThat(actual.keySet()).isEqualTo(expected.keySet());
        for (Map.Entry<Path, byte[]> entry : expected.entrySet()) {
            assertThat(actual.get(entry.getKey())).as(entry.getKey().toString()).isEqualTo(entry.getValue());
        }
    }

    private List<Element> liveElements() {
        List<Element> elements = new ArrayList<>();
        for (String layer : model.getLayerNames()) {
            elements.addAll(model.getLayer(layer).listElements());
        }
        return elements;
    }

    private static Map<String, Map<String, Object>> states(List<Element> elements) {
        Map<String, Map<String, Object>> states = new TreeMap<>();
        elements.forEach(e -> states.put(e.getId(), ElementStates.toState(e)));
        return states;
    }
}
