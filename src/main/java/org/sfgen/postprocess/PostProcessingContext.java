package org.sfgen.postprocess;

import org.sfgen.lang.SfgException;
import org.sfgen.lang.Variable;
import org.sfgen.lang.VariableConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The live set of one scope during postprocessing: variables required by later code
 * that no earlier code in the same scope has defined yet.
 * <p>
 * Variables are keyed by name. Deferred nodes may only be expanded while the context
 * is active, i.e. while its scope is being traversed.
 */
public class PostProcessingContext {

    private static final Logger LOG = LoggerFactory.getLogger(PostProcessingContext.class);

    private final Map<String, Variable> live = new LinkedHashMap<>();
    private final List<String> warnings;
    private int activeDepth;

    public PostProcessingContext() {
        this(new ArrayList<>());
    }

    PostProcessingContext(List<String> warnings) {
        this.warnings = warnings;
    }

    /**
     * @return A snapshot of the live variables, in the order they became live.
     */
    public Set<Variable> liveVariables() {
        return new LinkedHashSet<>(live.values());
    }

    public Optional<Variable> liveVariable(String name) {
        return Optional.ofNullable(live.get(name));
    }

    /**
     * Finds the live variable structurally corresponding to the given one: same name and
     * same type up to const qualification.
     *
     * @param v The variable to look for.
     * @return The live variable, if any.
     */
    public Optional<Variable> liveVariableMatching(Variable v) {
        Variable candidate = live.get(v.name());
        if (candidate != null && candidate.type().sameIgnoringConst(v.type())) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    public boolean isActive() {
        return activeDepth > 0;
    }

    void enter() {
        activeDepth++;
    }

    void leave() {
        activeDepth--;
    }

    /**
     * Records that the given variables are defined by a statement. Defined variables are
     * removed from the live set.
     *
     * @param vars The defined variables.
     * @param code The defining code, used in messages.
     * @throws VariableConflictException if a live variable of the same name has an incompatible type.
     */
    public void define(Collection<Variable> vars, String code) {
        for (Variable var : vars) {
            Variable liveVar = live.get(var.name());
            if (liveVar == null) {
                continue;
            }
            if (!liveVar.type().sameIgnoringConst(var.type())) {
                throw new VariableConflictException(
                        "Type conflict at variable definition '" + code + "'", liveVar, var);
            }
            if (var.type().isConst() && !liveVar.type().isConst()) {
                warn("Type conflict at variable definition: expected type " + liveVar.type()
                        + ", but got " + var.type() + " (at definition " + code + ")");
            }
            live.remove(var.name());
        }
    }

    /**
     * Adds the given variables to the live set, merging them with live variables of the same name.
     *
     * @param vars The required variables.
     * @throws VariableConflictException if a live variable of the same name has an incompatible type.
     */
    public void use(Collection<Variable> vars) {
        for (Variable var : vars) {
            Variable liveVar = live.get(var.name());
            if (liveVar == null) {
                live.put(var.name(), var);
            } else if (liveVar.equals(var)) {
                if (!liveVar.includes().equals(var.includes())) {
                    warn("Encountered two non-identical variables with same name and data type: "
                            + var.nameAndType() + " and " + liveVar.nameAndType());
                    live.put(var.name(), var);
                }
            } else if (liveVar.type().sameIgnoringConst(var.type())) {
                warn("Variables " + var.nameAndType() + " and " + liveVar.nameAndType()
                        + " differ only in constness; keeping the non-const one.");
                if (liveVar.type().isConst() && !var.type().isConst()) {
                    live.put(var.name(), var);
                }
            } else {
                throw new VariableConflictException(
                        "Encountered two variables with same name but different data types", var, liveVar);
            }
        }
    }

    private void warn(String message) {
        LOG.warn(message);
        warnings.add(message);
    }

    List<String> warningSink() {
        return warnings;
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "PostProcessingContext" + live.values();
    }
}
