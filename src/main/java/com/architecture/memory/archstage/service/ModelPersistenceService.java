package com.architecture.memory.archstage.service;

import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.ModelSnapshot;
import com.architecture.memory.archstage.repository.AtomicFileWriter;
import com.architecture.memory.archstage.repository.ModelRepository;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;

/**
 * The one write path for committed model state, shared by changeset commits and direct edits.
 *
 * Flow:
 * 1. Snapshot the in-memory model
 * 2. Run the mutation, which records the layers and extra documents it touched
 * 3. Serialize the touched layers, relationships, manifest and extra documents
 * 4. Write them all through {@link AtomicFileWriter}
 *
 * If any step fails the in-memory model is restored to the snapshot and the error is re-thrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelPersistenceService {

    private final ModelRepository modelRepository;
    private final AtomicFileWriter fileWriter;

    public <T> T applyAndPersist(ArchitectureModel model, Function<WriteSet, T> mutation) {
        ModelSnapshot snapshot = model.snapshot();
        WriteSet writes = new WriteSet();
        try {
            T result = mutation.apply(writes);
            Map<Path, byte[]> documents = modelRepository.prepareDocuments(model, writes.getLayers());
            documents.putAll(writes.getDocuments());
            fileWriter.writeAll(documents);
            log.debug("Persisted layers {} and {} extra document(s)", writes.getLayers(), writes.getDocuments().size());
            return result;
        } catch (RuntimeException e) {
            model.restore(snapshot);
            log.error("Write to model at {} failed, in-memory state restored: {}", model.getRootPath(), e.getMessage());
            throw e;
        }
    }

    /**
     * Persist the current in-memory state of the given layers.
     */
    public void persist(ArchitectureModel model, Collection<String> layers) {
        applyAndPersist(model, writes -> {
            writes.layers(layers);
            return null;
        });
    }

    /**
     * Layers and extra documents a mutation wants written together with the model.
     */
    @Getter
    public static class WriteSet {
        private final Set<String> layers = new LinkedHashSet<>();
        private final Map<Path, byte[]> documents = new LinkedHashMap<>();

        public WriteSet layer(String layer) {
            layers.add(layer);
            return this;
        }

        public WriteSet layers(Collection<String> names) {
            layers.addAll(names);
            return this;
        }

        public WriteSet documents(Map<Path, byte[]> extra) {
            documents.putAll(extra);
            return this;
        }
    }
}
