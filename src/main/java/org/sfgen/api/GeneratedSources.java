package org.sfgen.api;

import java.util.Optional;

/**
 * The text artifacts produced for one source file.
 *
 * @param headerName The file name of the header, e.g. {@code generated.hpp}.
 * @param header The header text.
 * @param implName The file name of the implementation file, or {@code null} in header-only mode.
 * @param impl The implementation text, or {@code null} in header-only mode.
 */
public record GeneratedSources(String headerName, String header, String implName, String impl) {

    public static GeneratedSources headerOnly(String headerName, String header) {
        return new GeneratedSources(headerName, header, null, null);
    }

    public Optional<String> implementation() {
        return Optional.ofNullable(impl);
    }

    public boolean isHeaderOnly() {
        return impl == null;
    }
}
