package com.flagship.nft_marketplace.marketplace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JournalTest {

    @Test
    @DisplayName("Rollback undoes mutations newest first")
    void testRollbackOrder() {
        Journal journal = new Journal();
        List<Integer> undone = new ArrayList<>();
        journal.record(() -> undone.add(1));
        journal.record(() -> undone.add(2));
        journal.record(() -> undone.add(3));

        journal.rollback(new IllegalStateException("failed"));

        assertEquals(List.of(3, 2, 1), undone);
        assertEquals(0, journal.size());
    }

    @Test
    @DisplayName("A failing undo step is attached to the original failure and the rest still run")
    void testFailingUndoStep() {
        Journal journal = new Journal();
        List<String> undone = new ArrayList<>();
        journal.record(() -> undone.add("first"));
        journal.record(() -> {
            throw new IllegalStateException("cannot undo");
        });
        journal.record(() -> undone.add("third"));
        RuntimeException cause = new IllegalArgumentException("original");

        journal.rollback(cause);

        assertEquals(List.of("third", "first"), undone);
        assertEquals(1, cause.getSuppressed().length);
        assertEquals("cannot undo", cause.getSuppressed()[0].getMessage());
    }
}
