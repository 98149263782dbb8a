package org.sfgen.postprocess;

import org.sfgen.lang.Variable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of postprocessing one call tree.
 *
 * @param functionParams The free variables the tree requires as parameters.
 * @param warnings Non-fatal warnings raised while merging variables.
 */
public record PostProcessingResult(Set<Variable> functionParams, List<String> warnings) {

    public PostProcessingResult {
        functionParams = Collections.unmodifiableSet(new LinkedHashSet<>(functionParams));
        warnings = List.copyOf(warnings);
    }
}
