package com.architecture.memory.archstage.repository;

import com.architecture.memory.archstage.exception.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomicFileWriterTest {

    @TempDir
    Path dir;

    @Test
    void writeAll_createsAndReplacesFiles() throws IOException {
        Path existing = dir.resolve("a.yaml");
        Files.writeString(existing, "old");
        Path fresh = dir.resolve("nested/b.yaml");

        new AtomicFileWriter().writeAll(documents(existing, "new-a", fresh, "new-b"));

        assertThat(existing).hasContent("new-a");
        assertThat(fresh).hasContent("new-b");
        assertThat(siblingsOf(dir)).containsExactlyInAnyOrder("a.yaml", "nested");
    }

    @Test
    void writeAll_failureDuringSwap_restoresPreviousContent() throws IOException {
        Path existing = dir.resolve("a.yaml");
        Files.writeString(existing, "old");
        Path fresh = dir.resolve("b.yaml");

        // move #1 backs up a.yaml, #2 swaps it in, #3 places b.yaml
        AtomicFileWriter writer = new AtomicFileWriter() {
            private int moves;

            @Override
            protected void moveFile(Path source, Path target) throws IOException {
                if (++moves == 3) {
                    throw new IOException("disk full");
                }
                super.moveFile(source, target);
            }
        };

        assertThatThrownBy(() -> writer.writeAll(documents(existing, "new-a", fresh, "new-b")))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("disk full");

        assertThat(existing).hasContent("old");
        assertThat(fresh).doesNotExist();
        assertThat(siblingsOf(dir)).containsExactly("a.yaml");
    }

    @Test
    void writeAll_failureWritingTempFile_leavesTargetsUntouched() throws IOException {
        Path existing = dir.resolve("a.yaml");
        Files.writeString(existing, "old");

        AtomicFileWriter writer = new AtomicFileWriter() {
            @Override
            protected void writeFile(Path path, byte[] content) throws IOException {
                throw new IOException("read-only");
            }
        };

        assertThatThrownBy(() -> writer.writeAll(documents(existing, "new-a", dir.resolve("b.yaml"), "new-b")))
                .isInstanceOf(PersistenceException.class);
        assertThat(existing).hasContent("old");
        assertThat(siblingsOf(dir)).containsExactly("a.yaml");
    }

    @Test
    void removeStaleTempFiles_keepsBackupsAndRecentTemps() throws IOException {
        Path staleTemp = Files.writeString(dir.resolve(".a.yaml.1234abcd.tmp"), "x");
        Path recentTemp = Files.writeString(dir.resolve(".b.yaml.1234abcd.tmp"), "x");
        Path backup = Files.writeString(dir.resolve(".a.yaml.1234abcd.bak"), "x");
        Path regular = Files.writeString(dir.resolve("a.yaml"), "x");
        FileTime old = FileTime.from(Instant.now().minus(Duration.ofHours(2)));
        Files.setLastModifiedTime(staleTemp, old);
        Files.setLastModifiedTime(backup, old);
        Files.setLastModifiedTime(regular, old);

        int removed = new AtomicFileWriter().removeStaleTempFiles(dir, Duration.ofHours(1));

        assertThat(removed).isEqualTo(1);
        assertThat(staleTemp).doesNotExist();
        assertThat(recentTemp).exists();
        assertThat(backup).exists();
        assertThat(regular).exists();
    }

    @Test
    void removeStaleTempFiles_missingDirectory_returnsZero() {
        assertThat(new AtomicFileWriter().removeStaleTempFiles(dir.resolve("missing"), Duration.ZERO)).isZero();
    }

    private static Map<Path, byte[]> documents(Path first, String firstContent, Path second, String secondContent) {
        Map<Path, byte[]> documents = new LinkedHashMap<>();
        documents.put(first, firstContent.getBytes(StandardCharsets.UTF_8));
        documents.put(second, secondContent.getBytes(StandardCharsets.UTF_8));
        return documents;
    }

    private static List<String> siblingsOf(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }
}
