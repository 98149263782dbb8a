package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.kernel.KernelHandle;
import org.sfgen.lang.DependentExpression;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Launch of a GPU kernel with an explicit launch configuration:
 * {@code kernel<<< blocks, threads[, stream] >>>(args);}.
 *
 * @param kernel The launched kernel.
 * @param numBlocks Number of blocks.
 * @param threadsPerBlock Threads per block.
 * @param stream The stream to launch on, or {@code null}.
 */
public record GpuKernelInvocation(
        KernelHandle kernel,
        DependentExpression numBlocks,
        DependentExpression threadsPerBlock,
        DependentExpression stream
) implements CallTreeLeaf {

    public GpuKernelInvocation {
        Objects.requireNonNull(kernel, "kernel");
        Objects.requireNonNull(numBlocks, "numBlocks");
        Objects.requireNonNull(threadsPerBlock, "threadsPerBlock");
        if (!kernel.kernel().isGpuKernel()) {
            throw new IllegalArgumentException("Kernel " + kernel.fqName() + " is not a GPU kernel and cannot be launched.");
        }
    }

    private List<DependentExpression> launchConfig() {
        List<DependentExpression> out = new ArrayList<>(List.of(numBlocks, threadsPerBlock));
        if (stream != null) {
            out.add(stream);
        }
        return out;
    }

    @Override
    public Set<Variable> depends() {
        Set<Variable> out = new LinkedHashSet<>(kernel.parameters());
        launchConfig().forEach(e -> out.addAll(e.depends()));
        return out;
    }

    @Override
    public Set<HeaderFile> ownIncludes() {
        Set<HeaderFile> out = new LinkedHashSet<>();
        launchConfig().forEach(e -> out.addAll(e.includes()));
        return out;
    }

    @Override
    public String render(CodeStyle style) {
        String grid = launchConfig().stream().map(DependentExpression::code).collect(Collectors.joining(", "));
        String args = kernel.parameters().stream().map(Variable::name).collect(Collectors.joining(", "));
        return kernel.fqName() + "<<< " + grid + " >>>(" + args + ");";
    }
}
