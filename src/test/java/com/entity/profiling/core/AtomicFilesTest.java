package com.entity.profiling.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AtomicFilesTest {

    @TempDir
    Path dir;

    @Test
    void createsParentDirectoriesAndWritesContent() throws IOException {
        Path target = dir.resolve("nested/out.json");
        AtomicFiles.write(target, "{}".getBytes(StandardCharsets.UTF_8));
        assertEquals("{}", Files.readString(target));
    }

    @Test
    void replacesExistingFileAndLeavesNoTemporaries() throws IOException {
        Path target = dir.resolve("out.json");
        AtomicFiles.write(target, "first".getBytes(StandardCharsets.UTF_8));
        AtomicFiles.write(target, "second".getBytes(StandardCharsets.UTF_8));

        assertEquals("second", Files.readString(target));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void failedWriteLeavesTargetUntouched() throws IOException {
        Path target = dir.resolve("out.json");
        Files.writeString(target, "original");
        Path blocked = dir.resolve("file-not-dir");
        Files.writeString(blocked, "x");

        assertThrows(IOException.class,
                () -> AtomicFiles.write(blocked.resolve("child.json"), new byte[]{1}));
        assertEquals("original", Files.readString(target));
    }
}
