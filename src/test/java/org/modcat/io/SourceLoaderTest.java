package org.modcat.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.MalformedInputException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void normalizesLineEndings() throws Exception {
        Path file = tempDir.resolve("crlf.py");
        Files.writeString(file, "a = 1\r\nb = 2\rc = 3\n");

        SourceLoader.LoadResult result = SourceLoader.loadFile(file);

        assertThat(result.content()).isEqualTo("a = 1\nb = 2\nc = 3\n");
        assertThat(result.logicalName()).endsWith("crlf.py");
    }

    @Test
    @Tag("unit")
    void rejectsMalformedUtf8() throws Exception {
        Path file = tempDir.resolve("binary.py");
        Files.write(file, new byte[]{(byte) 0xFF, (byte) 0xFE, (byte) 0xC3});

        assertThatThrownBy(() -> SourceLoader.loadFile(file)).isInstanceOf(MalformedInputException.class);
    }
}
