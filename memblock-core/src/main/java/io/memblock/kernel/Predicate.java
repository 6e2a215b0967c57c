package io.memblock.kernel;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Immutable filter expression over the columns of a block.
 * <p>
 * Columns are referenced by position, so a predicate carries no reference to the
 * block it is evaluated against. {@link Result} is the only resolved variant;
 * {@link Compare} and {@link MemberOf} are the leaves resolved against a single
 * column; the other variants are rewritten by {@link Predicates#simplify(Predicate)}.
 */
public sealed interface Predicate permits Predicate.AllRows, Predicate.Compare, Predicate.MemberOf,
        Predicate.And, Predicate.Or, Predicate.Not, Predicate.Subtract, Predicate.Result {

    enum Operator {
        EQ,
        NEQ,
        LT,
        LTE,
        GT,
        GTE;

        /**
         * Whether the operator relies on value ordering rather than equality.
         */
        public boolean isOrdering() {
            return this != EQ && this != NEQ;
        }
    }

    record AllRows() implements Predicate {
        public static final AllRows INSTANCE = new AllRows();
    }

    /**
     * Compares the value of a column with a constant. {@code value} may be null, which
     * is only meaningful for {@link Operator#EQ} and {@link Operator#NEQ}.
     */
    record Compare(int columnIndex, Object value, Operator operator) implements Predicate {
        public Compare {
            if (columnIndex < 0) {
                throw new IllegalArgumentException("columnIndex must be non-negative: " + columnIndex);
            }
            if (operator == null) {
                throw new IllegalArgumentException("operator required");
            }
        }
    }

    /**
     * Matches rows whose value is contained in {@code values}; the set may contain null.
     */
    record MemberOf(int columnIndex, Set<Object> values) implements Predicate {
        public MemberOf {
            if (columnIndex < 0) {
                throw new IllegalArgumentException("columnIndex must be non-negative: " + columnIndex);
            }
            if (values == null) {
                throw new IllegalArgumentException("values required");
            }
            values = Collections.unmodifiableSet(new HashSet<>(values));
        }

        public MemberOf(int columnIndex, Collection<?> values) {
            this(columnIndex, values == null ? null : new HashSet<Object>(values));
        }
    }

    record And(Predicate left, Predicate right) implements Predicate {
        public And {
            if (left == null || right == null) {
                throw new IllegalArgumentException("predicates required");
            }
        }
    }

    record Or(Predicate left, Predicate right) implements Predicate {
        public Or {
            if (left == null || right == null) {
                throw new IllegalArgumentException("predicates required");
            }
        }
    }

    record Not(Predicate inner) implements Predicate {
        public Not {
            if (inner == null) {
                throw new IllegalArgumentException("predicate required");
            }
        }
    }

    /**
     * Rows matching {@code left} but not {@code right}.
     */
    record Subtract(Predicate left, Predicate right) implements Predicate {
        public Subtract {
            if (left == null || right == null) {
                throw new IllegalArgumentException("predicates required");
            }
        }
    }

    record Result(Selection selection) implements Predicate {
        public Result {
            if (selection == null) {
                throw new IllegalArgumentException("selection required");
            }
        }
    }
}
