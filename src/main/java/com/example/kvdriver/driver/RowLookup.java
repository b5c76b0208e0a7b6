package com.example.kvdriver.driver;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a key lookup. {@code found} distinguishes a missing entry from an entry
 * whose stored value is itself null.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RowLookup {

    private static final RowLookup ABSENT = new RowLookup(null, false);

    Object value;
    boolean found;

    public static RowLookup of(Object value) {
        return new RowLookup(value, true);
    }

    public static RowLookup absent() {
        return ABSENT;
    }
}
