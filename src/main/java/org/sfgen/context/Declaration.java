package org.sfgen.context;

/**
 * A top-level element of a generated source file, registered in a {@link SourceFileContext}
 * in declaration order.
 */
public interface Declaration {

    /**
     * @return The name under which this declaration is registered, used for duplicate checks.
     */
    String declarationName();
}
