package org.sfgen.postprocess.deferred;

import org.sfgen.ir.CallTreeNode;
import org.sfgen.ir.DeferredExpansion;
import org.sfgen.ir.Sequence;
import org.sfgen.lang.extraction.VectorExtraction;
import org.sfgen.postprocess.PostProcessingContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the components of a vector-like data structure onto scalar variables, matched by name.
 * Only live components are defined; components the data structure cannot provide are omitted.
 */
public class VectorMappingExpansion implements DeferredExpansion {

    private final List<String> componentNames;
    private final VectorExtraction vector;

    /**
     * @param componentNames Names of the scalar symbols, one per component index.
     * @param vector The vector data structure.
     */
    public VectorMappingExpansion(List<String> componentNames, VectorExtraction vector) {
        this.componentNames = List.copyOf(componentNames);
        this.vector = vector;
    }

    @Override
    public CallTreeNode expand(PostProcessingContext ppc) {
        List<CallTreeNode> nodes = new ArrayList<>();
        for (int i = 0; i < componentNames.size(); i++) {
            int idx = i;
            ppc.liveVariable(componentNames.get(i)).ifPresent(param ->
                    vector.extractComponent(idx).ifPresent(expr ->
                            nodes.add(FieldMappingExpansion.definition(param, expr))));
        }
        return new Sequence(nodes);
    }
}
