package io.memblock.storage;

import io.memblock.kernel.Predicate.Operator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Column scans must return exactly the rows a naive reference comparison selects.
 */
class ColumnFilterEquivalenceTest {

    private static final Random RANDOM = new Random(1234);

    @Test
    void intColumnMatchesReferenceScan() {
        var column = new ArrayIntColumn(true);
        var reference = new ArrayList<Integer>();
        for (var i = 0; i < 500; i++) {
            var value = RANDOM.nextInt(5) == 0 ? null : RANDOM.nextInt(41) - 20;
            column.appendValue(value);
            reference.add(value);
        }

        for (var operator : Operator.values()) {
            for (var target = -22; target <= 22; target++) {
                assertThat(column.filter(operator, target))
                        .as("%s %d", operator, target)
                        .containsExactly(referenceScan(reference, operator, target));
            }
        }
    }

    @Test
    void longColumnMatchesReferenceScan() {
        var column = new ArrayLongColumn(false);
        var reference = new ArrayList<Long>();
        for (var i = 0; i < 500; i++) {
            var value = RANDOM.nextLong() >> 50;
            column.appendValue(value);
            reference.add(value);
        }

        for (var operator : Operator.values()) {
            for (var k = 0; k < 20; k++) {
                var target = reference.get(RANDOM.nextInt(reference.size())) + RANDOM.nextInt(3) - 1;
                assertThat(column.filter(operator, target))
                        .as("%s %d", operator, target)
                        .containsExactly(referenceScan(reference, operator, target));
            }
        }
    }

    @Test
    void stringColumnMatchesReferenceScan() {
        var dictionary = new String[] {"a", "ab", "b", "ba", "c", "", null};
        var column = new ArrayStringColumn();
        var reference = new ArrayList<String>();
        for (var i = 0; i < 300; i++) {
            var value = dictionary[RANDOM.nextInt(dictionary.length)];
            column.appendValue(value);
            reference.add(value);
        }

        for (var operator : Operator.values()) {
            for (var target : new String[] {"", "a", "aa", "b", "bb", "c", "d"}) {
                assertThat(column.filter(operator, target))
                        .as("%s %s", operator, target)
                        .containsExactly(referenceScan(reference, operator, target));
            }
        }
    }

    private static <T extends Comparable<T>> int[] referenceScan(List<T> values, Operator operator, T target) {
        var matches = new ArrayList<Integer>();
        for (var i = 0; i < values.size(); i++) {
            var value = values.get(i);
            boolean match;
            if (value == null) {
                match = operator == Operator.NEQ;
            } else {
                var comparison = value.compareTo(target);
                match = switch (operator) {
                    case EQ -> Objects.equals(value, target);
                    case NEQ -> !Objects.equals(value, target);
                    case LT -> comparison < 0;
                    case LTE -> comparison <= 0;
                    case GT -> comparison > 0;
                    case GTE -> comparison >= 0;
                };
            }
            if (match) {
                matches.add(i);
            }
        }
        return matches.stream().mapToInt(Integer::intValue).toArray();
    }
}
