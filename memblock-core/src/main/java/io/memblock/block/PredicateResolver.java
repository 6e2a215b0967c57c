package io.memblock.block;

import io.memblock.kernel.Predicate;
import io.memblock.kernel.Predicates;
import io.memblock.kernel.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Collapses a predicate tree into a {@link Predicate.Result}, one leaf at a time.
 * <p>
 * Each step simplifies the tree, resolves its first leaf against a column and splices
 * the resulting row set back in. A tree left without leaves only still references
 * {@link Predicate.AllRows}, which is then replaced by every row of the block.
 */
final class PredicateResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PredicateResolver.class);

    private PredicateResolver() {
    }

    /**
     * @param leafResolver evaluates a {@link Predicate.Compare} or {@link Predicate.MemberOf}
     * @throws IllegalStateException if the tree cannot be collapsed into a result
     */
    static Selection resolve(Predicate predicate, int recordCount, Function<Predicate, Selection> leafResolver) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate required");
        }
        var current = Predicates.simplified(predicate);
        var steps = 0;
        while (!(current instanceof Predicate.Result)) {
            var leaf = Predicates.firstLeaf(current);
            if (leaf.isEmpty()) {
                var allRows = new Predicate.Result(Selection.range(0, recordCount));
                var substituted = Predicates.substitute(current, Predicate.AllRows.INSTANCE, allRows)
                        .orElseThrow(() -> unresolvable(predicate));
                current = Predicates.simplified(substituted);
                if (!(current instanceof Predicate.Result)) {
                    throw unresolvable(predicate);
                }
                break;
            }
            var resolved = new Predicate.Result(leafResolver.apply(leaf.get()));
            LOG.trace("Resolved leaf {} to {} rows", leaf.get(), resolved.selection().size());
            current = Predicates.simplified(Predicates.substitute(current, leaf.get(), resolved)
                    .orElseThrow(() -> unresolvable(predicate)));
            steps++;
        }
        var result = ((Predicate.Result) current).selection();
        LOG.trace("Predicate resolved in {} steps to {} rows", steps, result.size());
        return result;
    }

    private static IllegalStateException unresolvable(Predicate predicate) {
        return new IllegalStateException("Predicate could not be resolved to a row set: " + predicate);
    }
}
