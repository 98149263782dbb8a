package org.sfgen.lang;

import java.util.Objects;

/**
 * A C++ header file, either a system header ({@code <vector>}) or a
 * project header ({@code "Kernels.hpp"}).
 *
 * @param path The (relative) path of the header.
 * @param systemHeader Whether this is a system header.
 */
public record HeaderFile(String path, boolean systemHeader) {

    public HeaderFile {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("Header path must not be empty");
        }
    }

    /**
     * Parses a header given as {@code <name>}, {@code "name"} or plain {@code name}.
     * Plain names are treated as project headers.
     *
     * @param header The header string.
     * @return The parsed header file.
     */
    public static HeaderFile parse(String header) {
        String h = header.strip();
        if (h.startsWith("<") && h.endsWith(">")) {
            return new HeaderFile(h.substring(1, h.length() - 1), true);
        }
        if (h.length() >= 2 && h.startsWith("\"") && h.endsWith("\"")) {
            h = h.substring(1, h.length() - 1);
        }
        return new HeaderFile(h, false);
    }

    public static HeaderFile system(String path) {
        return new HeaderFile(path, true);
    }

    /**
     * @return The argument of an {@code #include} directive for this header.
     */
    public String includeArgument() {
        return systemHeader ? "<" + path + ">" : "\"" + path + "\"";
    }

    @Override
    public String toString() {
        return systemHeader ? "<" + path + ">" : path;
    }
}
