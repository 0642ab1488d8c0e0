package com.architecture.memory.archstage.repository;

import com.architecture.memory.archstage.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes a group of documents as one unit.
 *
 * Flow:
 * 1. Write every document to a temp file next to its target
 * 2. Move each existing target aside to a backup, then move the temp file into place
 * 3. Delete the backups
 *
 * Any failure in step 1 or 2 restores every target to its previous content (or removes it
 * when it did not exist) and raises {@link PersistenceException}.
 */
@Component
@Slf4j
public class AtomicFileWriter {

    static final String TEMP_SUFFIX = ".tmp";
    static final String BACKUP_SUFFIX = ".bak";

    public void writeAll(Map<Path, byte[]> documents) {
        if (documents.isEmpty()) {
            return;
        }
        String txId = UUID.randomUUID().toString().substring(0, 8);
        Map<Path, Path> temps = new LinkedHashMap<>();
        Map<Path, Path> backups = new LinkedHashMap<>();
        List<Path> created = new ArrayList<>();

        try {
            for (Map.Entry<Path, byte[]> doc : documents.entrySet()) {
                Path target = doc.getKey();
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path temp = sibling(target, txId, TEMP_SUFFIX);
                temps.put(target, temp);
                writeFile(temp, doc.getValue());
            }

            for (Map.Entry<Path, Path> entry : temps.entrySet()) {
                Path target = entry.getKey();
                if (Files.exists(target)) {
                    Path backup = sibling(target, txId, BACKUP_SUFFIX);
                    moveFile(target, backup);
                    backups.put(target, backup);
                } else {
                    created.add(target);
                }
                moveFile(entry.getValue(), target);
            }
        } catch (IOException e) {
            log.error("Atomic write of {} document(s) failed, restoring previous files: {}", documents.size(), e.getMessage());
            rollback(temps, backups, created);
            throw new PersistenceException("Failed to write " + documents.size() + " document(s): " + e.getMessage(), e);
        }

        for (Path backup : backups.values()) {
            try {
                Files.deleteIfExists(backup);
            } catch (IOException e) {
                log.warn("Could not remove backup file {}: {}", backup, e.getMessage());
            }
        }
        log.debug("Wrote {} document(s) atomically (tx {})", documents.size(), txId);
    }

    /**
     * Write one file's bytes. Overridable so failures can be injected.
     */
    protected void writeFile(Path path, byte[] content) throws IOException {
        Files.write(path, content);
    }

    /**
     * Move a file, atomically where the file system supports it.
     */
    protected void moveFile(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void rollback(Map<Path, Path> temps, Map<Path, Path> backups, List<Path> created) {
        for (Path target : created) {
            deleteForRollback(target);
        }
        List<Map.Entry<Path, Path>> restore = new ArrayList<>(backups.entrySet());
        Collections.reverse(restore);
        for (Map.Entry<Path, Path> entry : restore) {
            try {
                Files.move(entry.getValue(), entry.getKey(), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                log.error("Could not restore {} from backup {}: {}", entry.getKey(), entry.getValue(), e.getMessage(), e);
            }
        }
        for (Path temp : temps.values()) {
            deleteForRollback(temp);
        }
    }

    private void deleteForRollback(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.error("Could not remove {} during rollback: {}", path, e.getMessage(), e);
        }
    }

    /**
     * Remove temp files left behind by an interrupted write that are older than {@code minAge}.
     * Backups are kept; after a failed restore they may be the only copy of a document.
     *
     * @return number of files removed
     */
    public int removeStaleTempFiles(Path dir, Duration minAge) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(minAge);
        List<Path> stale;
        try (Stream<Path> walk = Files.walk(dir)) {
            stale = walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(".") && name.endsWith(TEMP_SUFFIX);
                    })
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceException("Failed to scan " + dir + " for temp files", e);
        }
        int removed = 0;
        for (Path path : stale) {
            try {
                if (Files.getLastModifiedTime(path).toInstant().isBefore(cutoff) && Files.deleteIfExists(path)) {
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Could not remove stale temp file {}: {}", path, e.getMessage());
            }
        }
        return removed;
    }

    private static Path sibling(Path target, String txId, String suffix) {
        return target.resolveSibling("." + target.getFileName() + "." + txId + suffix);
    }
}
