package org.sfgen.ir.entities;

import org.sfgen.ir.CallTreeNode;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.Variable;
import org.sfgen.postprocess.CallTreePostProcessing;
import org.sfgen.postprocess.PostProcessingResult;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Computes the parameter list of a function-like entity by postprocessing its tree.
 */
final class ParameterCollection {

    private ParameterCollection() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param params The final parameter list.
     * @param warnings Warnings raised by postprocessing.
     */
    record Collected(List<Variable> params, List<String> warnings) {
    }

    /**
     * @param owner Name of the entity, used in messages.
     * @param tree The entity's tree; it is resolved in place.
     * @param requiredParams Explicitly listed parameters, or {@code null}.
     * @param implicit Variables available without being passed, e.g. class members.
     * @return The parameters: the explicit list if given, otherwise the free variables sorted by name.
     * @throws SfgException if explicit parameters were given and the tree has further free variables.
     */
    static Collected collect(String owner, CallTreeNode tree, List<Variable> requiredParams,
                             Predicate<Variable> implicit) {
        PostProcessingResult result = new CallTreePostProcessing().process(tree);
        return new Collected(select(owner, result.functionParams(), requiredParams, implicit), result.warnings());
    }

    /**
     * Chooses the parameter list from the free variables of an already resolved tree.
     *
     * @param owner Name of the entity, used in messages.
     * @param freeVariables The free variables of the resolved tree.
     * @param requiredParams Explicitly listed parameters, or {@code null}.
     * @param implicit Variables available without being passed.
     * @return The parameter list.
     * @throws SfgException if explicit parameters were given and there are further free variables.
     */
    static List<Variable> select(String owner, Collection<Variable> freeVariables, List<Variable> requiredParams,
                                 Predicate<Variable> implicit) {
        Set<Variable> free = new LinkedHashSet<>(freeVariables);
        free.removeIf(implicit);

        if (requiredParams != null) {
            Set<Variable> extras = new LinkedHashSet<>(free);
            requiredParams.forEach(extras::remove);
            if (!extras.isEmpty()) {
                throw new SfgException("Extraneous function parameters in " + owner
                        + ": Found free variables " + extras
                        + " that were not listed in manually specified function parameters.");
            }
            return List.copyOf(requiredParams);
        }
        return free.stream().sorted(Comparator.comparing(Variable::name)).toList();
    }
}
