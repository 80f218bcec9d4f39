package com.lendmatch.ranking;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Max-heap over an arena of user slots.
 *
 * <p>Each user owns a stable slot (integer handle) in the arena for as long as their
 * value is non-zero; the heap itself only stores slot handles, and each slot remembers
 * its current position in the heap. No node references point at each other.
 *
 * <p>The {@code order} list is split in two: positions {@code [0, sortedSize)} satisfy
 * the heap property, positions after that form an unsorted tail. When the sorted region
 * would reach {@code maxSortedSize} it is halved, so per-update cost stays bounded by
 * {@code log(maxSortedSize)} no matter how many users join. A user in the tail re-enters
 * the sorted region the next time their value increases.
 */
public class ArenaHeap implements RankingStructure {

    private final List<String> slotUser = new ArrayList<>();
    private final List<BigInteger> slotValue = new ArrayList<>();
    private final List<Integer> slotPosition = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();
    private final Map<String, Integer> slotOf = new HashMap<>();

    /** Heap order of slot handles. */
    private final List<Integer> order = new ArrayList<>();

    private int sortedSize;

    @Override
    public void update(String user, BigInteger oldValue, BigInteger newValue, int maxSortedSize) {
        if (user == null) {
            throw new IllegalArgumentException("Ranking member cannot be null");
        }
        if (maxSortedSize <= 0) {
            throw new IllegalArgumentException("maxSortedSize must be positive: " + maxSortedSize);
        }
        BigInteger stored = getValueOf(user);
        if (stored.compareTo(oldValue) != 0) {
            throw new IllegalArgumentException(
                    "Stale value for " + user + ": expected " + stored + " but caller passed " + oldValue);
        }

        int comparison = oldValue.compareTo(newValue);
        if (comparison == 0) {
            return;
        }
        if (newValue.signum() == 0) {
            remove(user, oldValue);
        } else if (oldValue.signum() == 0) {
            insert(user, newValue, maxSortedSize);
        } else if (comparison < 0) {
            increase(user, newValue, maxSortedSize);
        } else {
            decrease(user, newValue);
        }
    }

    @Override
    public String getHead() {
        return order.isEmpty() ? null : slotUser.get(order.get(0));
    }

    @Override
    public BigInteger getValueOf(String user) {
        Integer slot = slotOf.get(user);
        return slot == null ? BigInteger.ZERO : slotValue.get(slot);
    }

    @Override
    public boolean contains(String user) {
        return slotOf.containsKey(user);
    }

    @Override
    public int size() {
        return order.size();
    }

    @Override
    public List<String> descending() {
        return order.stream()
                .sorted(Comparator.comparing((Integer slot) -> slotValue.get(slot))
                        .reversed())
                .map(slotUser::get)
                .toList();
    }

    // ========================
    // MUTATIONS
    // ========================

    private void insert(String user, BigInteger value, int maxSortedSize) {
        int slot = allocate(user, value);
        order.add(slot);
        slotPosition.set(slot, order.size() - 1);

        // Pull the new entry to the first tail position, then sift it into the heap.
        int target = sortedSize;
        swap(target, order.size() - 1);
        shiftUp(target);
        sortedSize = computeSize(sortedSize + 1, maxSortedSize);
    }

    private void increase(String user, BigInteger value, int maxSortedSize) {
        int slot = slotOf.get(user);
        slotValue.set(slot, value);
        int position = slotPosition.get(slot);
        if (position < sortedSize) {
            shiftUp(position);
        } else {
            swap(sortedSize, position);
            shiftUp(sortedSize);
            sortedSize = computeSize(sortedSize + 1, maxSortedSize);
        }
    }

    private void decrease(String user, BigInteger value) {
        int slot = slotOf.get(user);
        slotValue.set(slot, value);
        int position = slotPosition.get(slot);
        if (position < sortedSize) {
            shiftDown(position);
        }
    }

    private void remove(String user, BigInteger removedValue) {
        int slot = slotOf.get(user);
        int position = slotPosition.get(slot);
        int last = order.size() - 1;

        swap(position, last);
        if (sortedSize == order.size()) {
            sortedSize--;
        }
        order.remove(last);
        release(user, slot);

        // The entry moved into the hole may be larger or smaller than the removed one.
        if (position < sortedSize) {
            BigInteger moved = slotValue.get(order.get(position));
            if (removedValue.compareTo(moved) > 0) {
                shiftDown(position);
            } else {
                shiftUp(position);
            }
        }
    }

    // ========================
    // ARENA
    // ========================

    private int allocate(String user, BigInteger value) {
        int slot;
        if (freeSlots.isEmpty()) {
            slot = slotUser.size();
            slotUser.add(user);
            slotValue.add(value);
            slotPosition.add(-1);
        } else {
            slot = freeSlots.pop();
            slotUser.set(slot, user);
            slotValue.set(slot, value);
        }
        slotOf.put(user, slot);
        return slot;
    }

    private void release(String user, int slot) {
        slotOf.remove(user);
        slotUser.set(slot, null);
        slotValue.set(slot, BigInteger.ZERO);
        slotPosition.set(slot, -1);
        freeSlots.push(slot);
    }

    // ========================
    // HEAP ORDER
    // ========================

    private void shiftUp(int position) {
        int current = position;
        while (current > 0) {
            int parent = (current - 1) / 2;
            if (valueAt(parent).compareTo(valueAt(current)) >= 0) {
                return;
            }
            swap(parent, current);
            current = parent;
        }
    }

    private void shiftDown(int position) {
        int current = position;
        while (true) {
            int left = 2 * current + 1;
            if (left >= sortedSize) {
                return;
            }
            int right = left + 1;
            int largest = right < sortedSize && valueAt(right).compareTo(valueAt(left)) > 0 ? right : left;
            if (valueAt(current).compareTo(valueAt(largest)) >= 0) {
                return;
            }
            swap(current, largest);
            current = largest;
        }
    }

    private BigInteger valueAt(int position) {
        return slotValue.get(order.get(position));
    }

    private void swap(int i, int j) {
        if (i == j) {
            return;
        }
        int slotI = order.get(i);
        int slotJ = order.get(j);
        order.set(i, slotJ);
        order.set(j, slotI);
        slotPosition.set(slotJ, i);
        slotPosition.set(slotI, j);
    }

    private static int computeSize(int size, int maxSortedSize) {
        int result = size;
        while (result >= maxSortedSize) {
            result >>= 1;
        }
        return result;
    }
}
