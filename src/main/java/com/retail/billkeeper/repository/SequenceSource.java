package com.retail.billkeeper.repository;

import java.util.Set;
import java.util.function.Function;

/**
 * Read access to the numbers already issued in a series, together with the
 * storage constraints that guard them.
 */
public interface SequenceSource {

    /**
     * Highest sequence value ever stored under the prefix, soft-deleted rows
     * included.
     *
     * @return the maximum, or null if the series is empty
     */
    Long findMaxSequence(String prefix);

    /**
     * Table the numbered rows are inserted into. A lock failure is only
     * treated as a numbering collision when it comes from an insert here.
     */
    String tableName();

    /**
     * Names of the unique constraints whose violation means another writer
     * took the same number.
     */
    Set<String> numberConstraintNames();

    static SequenceSource of(Function<String, Long> maxLookup, String tableName, String... constraintNames) {
        Set<String> names = Set.of(constraintNames);
        return new SequenceSource() {
            @Override
            public Long findMaxSequence(String prefix) {
                return maxLookup.apply(prefix);
            }

            @Override
            public String tableName() {
                return tableName;
            }

            @Override
            public Set<String> numberConstraintNames() {
                return names;
            }
        };
    }
}
