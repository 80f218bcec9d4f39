package com.lendmatch.ledger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Transaction-scoped log of state mutations.
 *
 * <p>Every write to ledger state registers the inverse write here while a transaction
 * is open. {@link #rollback()} replays the inverses newest-first, leaving the ledger
 * exactly as it was when {@link #begin()} ran. Outside a transaction (market setup
 * from tests, for instance) writes are not journaled.
 *
 * <p>Not thread-safe: only the thread holding the {@link Ledger} lock touches it.
 */
public class MutationJournal {

    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private boolean open;

    public void begin() {
        if (open) {
            throw new IllegalStateException("Ledger transaction already open");
        }
        undoLog.clear();
        open = true;
    }

    public void record(Runnable undo) {
        if (open) {
            undoLog.push(undo);
        }
    }

    public void commit() {
        undoLog.clear();
        open = false;
    }

    /**
     * Reverts every journaled mutation, newest first.
     *
     * @return number of mutations reverted
     */
    public int rollback() {
        int reverted = 0;
        open = false;
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
            reverted++;
        }
        return reverted;
    }

    public boolean isOpen() {
        return open;
    }

    public int size() {
        return undoLog.size();
    }
}
