package org.sfgen.config;

/**
 * Which files are produced.
 */
public enum OutputMode {
    /** A header with declarations plus an implementation file with definitions. */
    STANDALONE,
    /** A single header containing everything; free functions are printed {@code inline}. */
    HEADER_ONLY
}
