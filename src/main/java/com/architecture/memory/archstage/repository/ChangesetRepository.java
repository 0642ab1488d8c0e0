package com.architecture.memory.archstage.repository;

import com.architecture.memory.archstage.exception.PersistenceException;
import com.architecture.memory.archstage.model.changeset.BaseState;
import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.model.changeset.ChangesetMetadata;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Changeset storage under the model root:
 * <pre>
 * changesets/.active
 * changesets/{id}/metadata.yaml
 * changesets/{id}/changes.yaml
 * changesets/{id}/base-state.yaml
 * </pre>
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ChangesetRepository {

    static final String CHANGESETS_DIR = "changesets";
    static final String ACTIVE_FILE = ".active";
    static final String METADATA_FILE = "metadata.yaml";
    static final String CHANGES_FILE = "changes.yaml";
    static final String BASE_STATE_FILE = "base-state.yaml";

    private static final TypeReference<List<ChangeRecord>> CHANGE_LIST = new TypeReference<>() {
    };

    private final YAMLMapper yamlMapper;
    private final AtomicFileWriter fileWriter;

    // ========================= PATHS =========================

    public static Path changesetsDir(Path root) {
        return root.resolve(CHANGESETS_DIR);
    }

    public static Path changesetDir(Path root, String changesetId) {
        return changesetsDir(root).resolve(changesetId);
    }

    public static Path activePath(Path root) {
        return changesetsDir(root).resolve(ACTIVE_FILE);
    }

    // ========================= WRITE =========================

    /**
     * Write a new changeset together with the base state it was created against.
     */
    public void create(Path root, Changeset changeset, BaseState baseState) {
        try {
            Map<Path, byte[]> documents = documents(root, changeset.toMetadata(), changeset.getChanges());
            documents.put(changesetDir(root, changeset.getId()).resolve(BASE_STATE_FILE),
                    yamlMapper.writeValueAsBytes(baseState));
            fileWriter.writeAll(documents);
        } catch (IOException e) {
            throw new PersistenceException("Failed to serialize changeset " + changeset.getId(), e);
        }
    }

    public void save(Path root, Changeset changeset) {
        fileWriter.writeAll(documents(root, changeset.toMetadata(), changeset.getChanges()));
    }

    /**
     * Metadata and change log documents, for callers that write them as part of a larger unit.
     */
    public Map<Path, byte[]> documents(Path root, ChangesetMetadata metadata, List<ChangeRecord> changes) {
        Path dir = changesetDir(root, metadata.getId());
        try {
            Map<Path, byte[]> documents = new LinkedHashMap<>();
            documents.put(dir.resolve(METADATA_FILE), yamlMapper.writeValueAsBytes(metadata));
            documents.put(dir.resolve(CHANGES_FILE), yamlMapper.writeValueAsBytes(changes));
            return documents;
        } catch (IOException e) {
            throw new PersistenceException("Failed to serialize changeset " + metadata.getId(), e);
        }
    }

    public void delete(Path root, String changesetId) {
        Path dir = changesetDir(root, changesetId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : paths) {
                Files.delete(path);
            }
            log.debug("Deleted changeset directory {}", dir);
        } catch (IOException e) {
            throw new PersistenceException("Failed to delete changeset " + changesetId, e);
        }
    }

    // ========================= READ =========================

    public Optional<Changeset> findById(Path root, String changesetId) {
        Path dir = changesetDir(root, changesetId);
        Path metadataPath = dir.resolve(METADATA_FILE);
        if (!Files.exists(metadataPath)) {
            return Optional.empty();
        }
        try {
            ChangesetMetadata metadata = yamlMapper.readValue(metadataPath.toFile(), ChangesetMetadata.class);
            Path changesPath = dir.resolve(CHANGES_FILE);
            List<ChangeRecord> changes = Files.exists(changesPath)
                    ? yamlMapper.readValue(changesPath.toFile(), CHANGE_LIST)
                    : List.of();
            return Optional.of(Changeset.restore(metadata, changes));
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            throw new PersistenceException("Failed to read changeset " + changesetId + " from " + dir, e);
        }
    }

    public Optional<BaseState> findBaseState(Path root, String changesetId) {
        Path path = changesetDir(root, changesetId).resolve(BASE_STATE_FILE);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(yamlMapper.readValue(path.toFile(), BaseState.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read base state of changeset " + changesetId, e);
        }
    }

    /**
     * Every stored changeset, oldest first.
     */
    public List<Changeset> findAll(Path root) {
        Path dir = changesetsDir(root);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> ids;
        try (Stream<Path> entries = Files.list(dir)) {
            ids = entries.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceException("Failed to list changesets in " + dir, e);
        }
        List<Changeset> changesets = new ArrayList<>();
        for (String id : ids) {
            findById(root, id).ifPresent(changesets::add);
        }
        changesets.sort(Comparator.comparing(Changeset::getCreated, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(Changeset::getId));
        return changesets;
    }

    // ========================= ACTIVE POINTER =========================

    public Optional<String> readActive(Path root) {
        Path path = activePath(root);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            String id = Files.readString(path, StandardCharsets.UTF_8).trim();
            return id.isEmpty() ? Optional.empty() : Optional.of(id);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read active changeset pointer " + path, e);
        }
    }

    public void writeActive(Path root, String changesetId) {
        fileWriter.writeAll(Map.of(activePath(root), changesetId.getBytes(StandardCharsets.UTF_8)));
    }

    public void clearActive(Path root) {
        try {
            Files.deleteIfExists(activePath(root));
        } catch (IOException e) {
            throw new PersistenceException("Failed to clear active changeset pointer", e);
        }
    }
}
