package com.lendmatch.ranking;

import java.math.BigInteger;
import java.util.List;

/**
 * Balance-ordered set of users for one (market, side, bucket), used by the matching
 * engine to pick promotion and demotion candidates.
 *
 * <p>A user is a member if and only if their value is non-zero: updating to zero
 * removes them, updating from zero inserts them.
 */
public interface RankingStructure {

    /**
     * Moves {@code user} from {@code oldValue} to {@code newValue}.
     *
     * @param oldValue      the user's current value (zero when absent)
     * @param newValue      the value to store (zero removes the user)
     * @param maxSortedSize bound on the sorted region; must be positive
     * @throws IllegalArgumentException if {@code oldValue} does not match the stored value
     */
    void update(String user, BigInteger oldValue, BigInteger newValue, int maxSortedSize);

    /** Best candidate (highest value in the sorted region), or null when empty. */
    String getHead();

    /** Stored value of {@code user}, zero when absent. */
    BigInteger getValueOf(String user);

    boolean contains(String user);

    int size();

    /** All members, highest value first. */
    List<String> descending();
}
