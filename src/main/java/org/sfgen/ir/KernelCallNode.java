package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.kernel.KernelHandle;
import org.sfgen.lang.Variable;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A call to a kernel, passing the kernel's parameters by name.
 *
 * @param kernel The called kernel.
 */
public record KernelCallNode(KernelHandle kernel) implements CallTreeLeaf {

    public KernelCallNode {
        Objects.requireNonNull(kernel, "kernel");
    }

    @Override
    public Set<Variable> depends() {
        return new LinkedHashSet<>(kernel.parameters());
    }

    @Override
    public String render(CodeStyle style) {
        String args = kernel.parameters().stream().map(Variable::name).collect(Collectors.joining(", "));
        return kernel.fqName() + "(" + args + ");";
    }
}
