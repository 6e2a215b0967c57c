package io.memblock.kernel;

import io.memblock.kernel.Predicate.AllRows;
import io.memblock.kernel.Predicate.And;
import io.memblock.kernel.Predicate.Compare;
import io.memblock.kernel.Predicate.MemberOf;
import io.memblock.kernel.Predicate.Not;
import io.memblock.kernel.Predicate.Operator;
import io.memblock.kernel.Predicate.Or;
import io.memblock.kernel.Predicate.Result;
import io.memblock.kernel.Predicate.Subtract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Factories and rewrite rules of the predicate algebra.
 * <p>
 * Every rewrite is a set-algebra identity, so simplifying never changes the rows a
 * predicate matches:
 * <ul>
 *   <li>{@code And(AllRows, X) = X}, {@code And(X, AllRows) = X}</li>
 *   <li>{@code And(Result(a), Result(b)) = Result(a ∩ b)}</li>
 *   <li>{@code Or(AllRows, X) = Or(X, AllRows) = AllRows}</li>
 *   <li>{@code Or(Result(a), Result(b)) = Result(a ∪ b)}</li>
 *   <li>{@code Not(X) = Subtract(AllRows, X)}</li>
 *   <li>{@code Subtract(Result(a), Result(b)) = Result(a \ b)}</li>
 * </ul>
 * Composite nodes otherwise simplify their children and are rebuilt when one changed.
 */
public final class Predicates {

    private Predicates() {
    }

    public static Predicate allRows() {
        return AllRows.INSTANCE;
    }

    public static Predicate compare(int columnIndex, Operator operator, Object value) {
        return new Compare(columnIndex, value, operator);
    }

    public static Predicate eq(int columnIndex, Object value) {
        return new Compare(columnIndex, value, Operator.EQ);
    }

    public static Predicate neq(int columnIndex, Object value) {
        return new Compare(columnIndex, value, Operator.NEQ);
    }

    public static Predicate lt(int columnIndex, Object value) {
        return new Compare(columnIndex, value, Operator.LT);
    }

    public static Predicate lte(int columnIndex, Object value) {
        return new Compare(columnIndex, value, Operator.LTE);
    }

    public static Predicate gt(int columnIndex, Object value) {
        return new Compare(columnIndex, value, Operator.GT);
    }

    public static Predicate gte(int columnIndex, Object value) {
        return new Compare(columnIndex, value, Operator.GTE);
    }

    public static Predicate memberOf(int columnIndex, Collection<?> values) {
        return new MemberOf(columnIndex, values);
    }

    public static Predicate memberOf(int columnIndex, Object... values) {
        return new MemberOf(columnIndex, Arrays.asList(values));
    }

    /**
     * Left-deep conjunction of at least one predicate.
     */
    public static Predicate and(Predicate first, Predicate... others) {
        var result = first;
        for (var other : others) {
            result = new And(result, other);
        }
        return result;
    }

    /**
     * Left-deep disjunction of at least one predicate.
     */
    public static Predicate or(Predicate first, Predicate... others) {
        var result = first;
        for (var other : others) {
            result = new Or(result, other);
        }
        return result;
    }

    public static Predicate not(Predicate inner) {
        return new Not(inner);
    }

    public static Predicate subtract(Predicate left, Predicate right) {
        return new Subtract(left, right);
    }

    public static Predicate result(Selection selection) {
        return new Result(selection);
    }

    public static Predicate result(int... rowIndexes) {
        return new Result(Selection.of(rowIndexes));
    }

    /**
     * Distinct {@link Compare} and {@link MemberOf} nodes of the tree, leftmost
     * depth-first first.
     */
    public static List<Predicate> leafPredicates(Predicate predicate) {
        var leaves = new LinkedHashSet<Predicate>();
        collectLeaves(predicate, leaves);
        return List.copyOf(leaves);
    }

    /**
     * First unresolved leaf in depth-first order, if any.
     */
    public static Optional<Predicate> firstLeaf(Predicate predicate) {
        if (predicate instanceof Compare || predicate instanceof MemberOf) {
            return Optional.of(predicate);
        }
        for (var child : children(predicate)) {
            var leaf = firstLeaf(child);
            if (leaf.isPresent()) {
                return leaf;
            }
        }
        return Optional.empty();
    }

    /**
     * Column indexes referenced by the leaves of the tree, ascending.
     */
    public static SortedSet<Integer> referencedColumnIndexes(Predicate predicate) {
        var indexes = new TreeSet<Integer>();
        for (var leaf : leafPredicates(predicate)) {
            if (leaf instanceof Compare compare) {
                indexes.add(compare.columnIndex());
            } else if (leaf instanceof MemberOf memberOf) {
                indexes.add(memberOf.columnIndex());
            }
        }
        return indexes;
    }

    /**
     * Rewrites the tree until no rule applies.
     *
     * @return the simplified tree, or empty when no rule applied
     */
    public static Optional<Predicate> simplify(Predicate predicate) {
        var current = predicate;
        var changed = false;
        var next = rewrite(current);
        while (next != null) {
            current = next;
            changed = true;
            next = rewrite(current);
        }
        return changed ? Optional.of(current) : Optional.empty();
    }

    /**
     * {@link #simplify(Predicate)}, returning the predicate itself when unchanged.
     */
    public static Predicate simplified(Predicate predicate) {
        return simplify(predicate).orElse(predicate);
    }

    /**
     * Replaces every node structurally equal to {@code before} with {@code after}.
     *
     * @return the rewritten tree, or empty when {@code before} does not occur
     */
    public static Optional<Predicate> substitute(Predicate predicate, Predicate before, Predicate after) {
        if (predicate.equals(before)) {
            return Optional.of(after);
        }
        if (predicate instanceof And and) {
            var left = substitute(and.left(), before, after);
            var right = substitute(and.right(), before, after);
            if (left.isPresent() || right.isPresent()) {
                return Optional.of(new And(left.orElse(and.left()), right.orElse(and.right())));
            }
        } else if (predicate instanceof Or or) {
            var left = substitute(or.left(), before, after);
            var right = substitute(or.right(), before, after);
            if (left.isPresent() || right.isPresent()) {
                return Optional.of(new Or(left.orElse(or.left()), right.orElse(or.right())));
            }
        } else if (predicate instanceof Subtract subtract) {
            var left = substitute(subtract.left(), before, after);
            var right = substitute(subtract.right(), before, after);
            if (left.isPresent() || right.isPresent()) {
                return Optional.of(new Subtract(left.orElse(subtract.left()), right.orElse(subtract.right())));
            }
        } else if (predicate instanceof Not not) {
            return substitute(not.inner(), before, after).<Predicate>map(Not::new);
        }
        return Optional.empty();
    }

    // One rewrite step; null when no rule applies anywhere in the tree
    private static Predicate rewrite(Predicate predicate) {
        if (predicate instanceof And and) {
            return rewriteAnd(and);
        }
        if (predicate instanceof Or or) {
            return rewriteOr(or);
        }
        if (predicate instanceof Not not) {
            return new Subtract(AllRows.INSTANCE, not.inner());
        }
        if (predicate instanceof Subtract subtract) {
            return rewriteSubtract(subtract);
        }
        return null;
    }

    private static Predicate rewriteAnd(And and) {
        var left = and.left();
        var right = and.right();
        if (left instanceof AllRows) {
            return right;
        }
        if (right instanceof AllRows) {
            return left;
        }
        if (left instanceof Result a && right instanceof Result b) {
            return new Result(a.selection().intersect(b.selection()));
        }
        var newLeft = rewrite(left);
        var newRight = rewrite(right);
        if (newLeft == null && newRight == null) {
            return null;
        }
        return new And(newLeft != null ? newLeft : left, newRight != null ? newRight : right);
    }

    private static Predicate rewriteOr(Or or) {
        var left = or.left();
        var right = or.right();
        if (left instanceof AllRows || right instanceof AllRows) {
            return AllRows.INSTANCE;
        }
        if (left instanceof Result a && right instanceof Result b) {
            return new Result(a.selection().union(b.selection()));
        }
        var newLeft = rewrite(left);
        var newRight = rewrite(right);
        if (newLeft == null && newRight == null) {
            return null;
        }
        return new Or(newLeft != null ? newLeft : left, newRight != null ? newRight : right);
    }

    private static Predicate rewriteSubtract(Subtract subtract) {
        var left = subtract.left();
        var right = subtract.right();
        if (left instanceof Result a && right instanceof Result b) {
            return new Result(a.selection().subtract(b.selection()));
        }
        var newLeft = rewrite(left);
        var newRight = rewrite(right);
        if (newLeft == null && newRight == null) {
            return null;
        }
        return new Subtract(newLeft != null ? newLeft : left, newRight != null ? newRight : right);
    }

    private static void collectLeaves(Predicate predicate, Set<Predicate> leaves) {
        if (predicate instanceof Compare || predicate instanceof MemberOf) {
            leaves.add(predicate);
            return;
        }
        for (var child : children(predicate)) {
            collectLeaves(child, leaves);
        }
    }

    private static List<Predicate> children(Predicate predicate) {
        var children = new ArrayList<Predicate>(2);
        if (predicate instanceof And and) {
            children.add(and.left());
            children.add(and.right());
        } else if (predicate instanceof Or or) {
            children.add(or.left());
            children.add(or.right());
        } else if (predicate instanceof Subtract subtract) {
            children.add(subtract.left());
            children.add(subtract.right());
        } else if (predicate instanceof Not not) {
            children.add(not.inner());
        }
        return children;
    }
}
