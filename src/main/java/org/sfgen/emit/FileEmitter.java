package org.sfgen.emit;

import org.sfgen.api.GeneratedSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes generated sources into an output directory.
 */
public class FileEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(FileEmitter.class);

    private final Path outputDirectory;

    public FileEmitter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Writes the header and, unless in header-only mode, the implementation file.
     * Existing files are overwritten.
     *
     * @param sources The generated sources.
     * @return The written files.
     * @throws IOException if the directory cannot be created or a file cannot be written.
     */
    public List<Path> emit(GeneratedSources sources) throws IOException {
        Files.createDirectories(outputDirectory);
        List<Path> written = new ArrayList<>();
        written.add(write(sources.headerName(), sources.header()));
        if (!sources.isHeaderOnly()) {
            written.add(write(sources.implName(), sources.impl()));
        }
        return written;
    }

    private Path write(String name, String content) throws IOException {
        Path file = outputDirectory.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        LOG.info("Wrote {}", file.toAbsolutePath());
        return file;
    }
}
