package org.sfgen.kernel;

import org.sfgen.context.Declaration;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.SfgException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A namespace grouping a number of kernels.
 */
public final class KernelNamespace implements Declaration {

    private final String name;
    private final String outerNamespace;
    private final Map<String, KernelHandle> kernels = new LinkedHashMap<>();

    /**
     * @param name The local name of this namespace.
     * @param outerNamespace The fully qualified enclosing namespace, empty for the global namespace.
     */
    public KernelNamespace(String name, String outerNamespace) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Kernel namespace name must not be empty");
        }
        this.name = name;
        this.outerNamespace = outerNamespace == null ? "" : outerNamespace;
    }

    public String name() {
        return name;
    }

    public String fqName() {
        return outerNamespace.isEmpty() ? name : outerNamespace + "::" + name;
    }

    /**
     * Registers a kernel under its own name.
     *
     * @param kernel The kernel.
     * @return The handle to the registered kernel.
     * @throws SfgException if a kernel of that name already exists in this namespace.
     */
    public KernelHandle add(Kernel kernel) {
        return add(kernel, kernel.name());
    }

    /**
     * Registers a kernel under the given name.
     *
     * @param kernel The kernel.
     * @param kernelName The name to register the kernel under.
     * @return The handle to the registered kernel.
     */
    public KernelHandle add(Kernel kernel, String kernelName) {
        if (kernels.containsKey(kernelName)) {
            throw new SfgException("Duplicate kernels: A kernel called " + kernelName
                    + " already exists in namespace " + fqName());
        }
        KernelHandle handle = new KernelHandle(kernelName, this, kernel);
        kernels.put(kernelName, handle);
        return handle;
    }

    public Optional<KernelHandle> find(String kernelName) {
        return Optional.ofNullable(kernels.get(kernelName));
    }

    public Collection<KernelHandle> kernels() {
        return Collections.unmodifiableCollection(kernels.values());
    }

    public boolean isEmpty() {
        return kernels.isEmpty();
    }

    public Set<HeaderFile> requiredHeaders() {
        Set<HeaderFile> out = new LinkedHashSet<>();
        kernels.values().forEach(k -> out.addAll(k.requiredHeaders()));
        return out;
    }

    @Override
    public String declarationName() {
        return name;
    }
}
