package org.sfgen.postprocess;

import org.sfgen.ir.Block;
import org.sfgen.ir.CallTreeNode;
import org.sfgen.ir.DeferredNode;
import org.sfgen.ir.Sequence;
import org.sfgen.ir.Statements;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.sfgen.ir.CallTrees.block;
import static org.sfgen.ir.CallTrees.seq;

@Tag("unit")
class SequenceFlattenerTest {

    private final Statements a = Statements.of("a;");
    private final Statements b = Statements.of("b;");
    private final Statements c = Statements.of("c;");
    private final Statements d = Statements.of("d;");
    private final Statements e = Statements.of("e;");
    private final Statements f = Statements.of("f;");

    @Test
    @DisplayName("Nested sequences are spliced in order, other scopes are flattened separately")
    void flattenAll_shouldSpliceNestedSequencesInOrder() {
        Block blk = block(d, seq(e));
        Sequence root = seq(a, seq(b, seq(c)), blk, f);

        SequenceFlattener.flattenAll(root);

        assertThat(root.children()).containsExactly(a, b, c, blk, f);
        assertThat(blk.body().children()).containsExactly(d, e);
    }

    @Test
    void flattenAll_shouldBeIdempotent() {
        Sequence root = seq(a, seq(seq(b), c), seq());

        SequenceFlattener.flattenAll(root);
        List<CallTreeNode> once = List.copyOf(root.children());
        SequenceFlattener.flattenAll(root);

        assertThat(root.children()).containsExactlyElementsOf(once);
        assertThat(once).containsExactly(a, b, c);
    }

    @Test
    void flatten_shouldLeaveDeferredNodesInPlace() {
        DeferredNode deferred = new DeferredNode("later", ppc -> Sequence.empty());
        Sequence root = seq(a, seq(deferred, b));

        root.flatten();

        assertThat(root.children()).containsExactly(a, deferred, b);
    }
}
