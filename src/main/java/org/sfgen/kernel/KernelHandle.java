package org.sfgen.kernel;

import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.Variable;

import java.util.List;
import java.util.Set;

/**
 * Handle to a kernel registered in a {@link KernelNamespace}.
 * <p>
 * The kernel's parameters are converted to canonical {@link Variable}s when the handle is created.
 */
public final class KernelHandle {

    private final String name;
    private final KernelNamespace namespace;
    private final Kernel kernel;
    private final List<Variable> parameters;

    KernelHandle(String name, KernelNamespace namespace, Kernel kernel) {
        this.name = name;
        this.namespace = namespace;
        this.kernel = kernel;
        this.parameters = kernel.parameters().stream()
                .map(p -> new Variable(p.name(), p.type()))
                .toList();
    }

    public String name() {
        return name;
    }

    /**
     * @return The fully qualified name, e.g. {@code app::kernels::jacobi}.
     */
    public String fqName() {
        return namespace.fqName() + "::" + name;
    }

    public KernelNamespace namespace() {
        return namespace;
    }

    public Kernel kernel() {
        return kernel;
    }

    public List<Variable> parameters() {
        return parameters;
    }

    public Set<HeaderFile> requiredHeaders() {
        return kernel.requiredHeaders();
    }

    @Override
    public String toString() {
        return fqName();
    }
}
