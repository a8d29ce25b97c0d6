package org.modcat.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void writesIntoMissingDirectories() throws Exception {
        Path target = tempDir.resolve("out/nested/combined.py");

        Path written = ArtifactWriter.write(target, "print('hi')\n");

        assertThat(written).isEqualTo(target.toAbsolutePath().normalize());
        assertThat(Files.readString(target)).isEqualTo("print('hi')\n");
    }

    @Test
    @Tag("unit")
    void replacesExistingFileWithoutLeavingTempFiles() throws Exception {
        Path target = tempDir.resolve("combined.py");
        Files.writeString(target, "old");

        ArtifactWriter.write(target, "new");

        assertThat(Files.readString(target)).isEqualTo("new");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    @Tag("unit")
    void failedWriteKeepsPreviousFileAndRemovesTempFile() throws Exception {
        Path target = tempDir.resolve("combined.py");
        Files.writeString(target, "old");

        // A lone surrogate cannot be encoded as UTF-8, so the write fails after the temp file exists
        assertThatThrownBy(() -> ArtifactWriter.write(target, "a\uD800b"))
                .isInstanceOf(IOException.class);

        assertThat(Files.readString(target)).isEqualTo("old");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }
}
