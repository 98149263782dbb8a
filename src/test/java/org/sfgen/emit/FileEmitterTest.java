package org.sfgen.emit;

import org.sfgen.api.GeneratedSources;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class FileEmitterTest {

    @TempDir
    Path tempDir;

    @Test
    void emit_shouldWriteHeaderAndImplementation() throws IOException {
        Path out = tempDir.resolve("gen");
        GeneratedSources sources = new GeneratedSources("a.hpp", "#pragma once\n", "a.cpp", "#include \"a.hpp\"\n");

        List<Path> written = new FileEmitter(out).emit(sources);

        assertThat(written).containsExactly(out.resolve("a.hpp"), out.resolve("a.cpp"));
        assertThat(Files.readString(out.resolve("a.hpp"))).isEqualTo("#pragma once\n");
        assertThat(Files.readString(out.resolve("a.cpp"))).isEqualTo("#include \"a.hpp\"\n");
    }

    @Test
    void emit_shouldWriteOnlyHeaderInHeaderOnlyMode() throws IOException {
        GeneratedSources sources = GeneratedSources.headerOnly("a.hpp", "#pragma once\n");

        List<Path> written = new FileEmitter(tempDir).emit(sources);

        assertThat(written).containsExactly(tempDir.resolve("a.hpp"));
        assertThat(tempDir.resolve("a.cpp")).doesNotExist();
    }
}
