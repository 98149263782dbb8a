package org.sfgen.kernel;

import org.sfgen.config.CodeStyle;
import org.sfgen.lang.HeaderFile;

import java.util.List;
import java.util.Set;

/**
 * A pre-generated computational kernel. Kernels are produced elsewhere and treated as
 * read-only data by the generator.
 */
public interface Kernel {

    String name();

    /**
     * @return The ordered parameter list of this kernel.
     */
    List<KernelParameter> parameters();

    /**
     * @return Headers the kernel's definition requires.
     */
    Set<HeaderFile> requiredHeaders();

    /**
     * Renders the complete definition of this kernel function.
     *
     * @param style The code style to use.
     * @param functionName The name to define the function under; differs from {@link #name()}
     *        when the kernel was registered under another name.
     * @return The definition text, without trailing line break.
     */
    String renderDefinition(CodeStyle style, String functionName);

    /**
     * @return Whether this kernel must be launched as a GPU kernel.
     */
    default boolean isGpuKernel() {
        return false;
    }
}
