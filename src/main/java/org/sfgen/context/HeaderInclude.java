package org.sfgen.context;

import org.sfgen.lang.HeaderFile;

/**
 * An include directive registered in a source file.
 *
 * @param header The included header.
 * @param privateInclude Whether the include belongs to the implementation file only.
 */
public record HeaderInclude(HeaderFile header, boolean privateInclude) implements Declaration {

    @Override
    public String declarationName() {
        return header.includeArgument();
    }
}
