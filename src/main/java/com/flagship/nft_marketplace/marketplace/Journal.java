package com.flagship.nft_marketplace.marketplace;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo log of a single ledger operation.
 *
 * Each mutation records how to reverse itself. On failure the recorded
 * actions run newest first, restoring the state the operation started from.
 */
@Slf4j
class Journal {

    private final Deque<Runnable> undo = new ArrayDeque<>();

    void record(Runnable action) {
        undo.push(action);
    }

    int size() {
        return undo.size();
    }

    /**
     * Reverses every recorded mutation. Failures while undoing are attached to
     * {@code cause} as suppressed exceptions.
     */
    void rollback(RuntimeException cause) {
        int steps = undo.size();
        while (!undo.isEmpty()) {
            try {
                undo.pop().run();
            } catch (RuntimeException e) {
                log.error("Undo step failed while rolling back: {}", e.getMessage());
                cause.addSuppressed(e);
            }
        }
        log.debug("Rolled back {} mutation(s) after: {}", steps, cause.getMessage());
    }
}
