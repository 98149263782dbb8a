package org.sfgen.kernel;

import org.sfgen.lang.CppType;

/**
 * A parameter of an externally generated kernel.
 *
 * @param name The parameter name.
 * @param type The parameter type.
 */
public record KernelParameter(String name, CppType type) {
}
