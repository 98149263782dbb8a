package org.sfgen.config;

import java.util.Locale;
import java.util.Objects;

/**
 * Describes the output files of one generator run.
 *
 * @param basename File name without extension.
 * @param headerExtension Extension of the header file, without leading dot.
 * @param implExtension Extension of the implementation file, without leading dot.
 * @param mode The output mode.
 * @param includeGuard The include guard style of the header.
 * @param namespace The enclosing namespace, empty for the global namespace.
 * @param prelude Comment text printed at the top of every file, may be empty.
 */
public record OutputSpec(
        String basename,
        String headerExtension,
        String implExtension,
        OutputMode mode,
        IncludeGuard includeGuard,
        String namespace,
        String prelude
) {

    /**
     * Style of the header's include guard.
     */
    public enum IncludeGuard {
        PRAGMA,
        MACRO
    }

    public OutputSpec {
        Objects.requireNonNull(basename, "basename");
        if (basename.isBlank()) {
            throw new IllegalArgumentException("Output basename must not be empty");
        }
        headerExtension = stripDot(headerExtension);
        implExtension = stripDot(implExtension);
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(includeGuard, "includeGuard");
        namespace = namespace == null ? "" : namespace.strip();
        prelude = prelude == null ? "" : prelude;
    }

    public static OutputSpec of(String basename) {
        return new OutputSpec(basename, "hpp", "cpp", OutputMode.STANDALONE, IncludeGuard.PRAGMA, "", "");
    }

    private static String stripDot(String ext) {
        Objects.requireNonNull(ext, "extension");
        return ext.startsWith(".") ? ext.substring(1) : ext;
    }

    public String headerFilename() {
        return basename + "." + headerExtension;
    }

    public String implFilename() {
        return basename + "." + implExtension;
    }

    public boolean headerOnly() {
        return mode == OutputMode.HEADER_ONLY;
    }

    /**
     * @return The macro name used by {@link IncludeGuard#MACRO}, e.g. {@code GENERATED_HPP}.
     */
    public String guardMacro() {
        return headerFilename().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    public OutputSpec withMode(OutputMode m) {
        return new OutputSpec(basename, headerExtension, implExtension, m, includeGuard, namespace, prelude);
    }

    public OutputSpec withIncludeGuard(IncludeGuard g) {
        return new OutputSpec(basename, headerExtension, implExtension, mode, g, namespace, prelude);
    }
}
