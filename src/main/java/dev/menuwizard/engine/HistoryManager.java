package dev.menuwizard.engine;

import dev.menuwizard.model.FieldsPatch;
import dev.menuwizard.model.SessionFields;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Linear undo/redo over {@link SessionFields} snapshots. Snapshots are immutable values, and
 * restores go through {@link SessionStore#update(FieldsPatch)} like any other change.
 */
public final class HistoryManager {

    private final SessionStore store;
    private final int limit;
    private final Deque<SessionFields> undoStack = new ArrayDeque<>();
    private final Deque<SessionFields> redoStack = new ArrayDeque<>();

    public HistoryManager(SessionStore store, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be at least 1, was " + limit);
        }
        this.store = store;
        this.limit = limit;
    }

    /**
     * Snapshot the current fields before a user action changes them. Starts a new branch of
     * history, so anything that could have been redone is dropped.
     */
    public void recordBeforeChange() {
        undoStack.push(store.fields());
        if (undoStack.size() > limit) {
            undoStack.removeLast();
        }
        redoStack.clear();
    }

    /**
     * Restore the latest snapshot. Returns false when there is nothing to undo.
     */
    public boolean undo() {
        if (undoStack.isEmpty()) {
            return false;
        }
        SessionFields previous = undoStack.pop();
        redoStack.push(store.fields());
        store.update(FieldsPatch.replacing(previous));
        return true;
    }

    /**
     * Re-apply the last undone state. Returns false when there is nothing to redo.
     */
    public boolean redo() {
        if (redoStack.isEmpty()) {
            return false;
        }
        SessionFields next = redoStack.pop();
        undoStack.push(store.fields());
        store.update(FieldsPatch.replacing(next));
        return true;
    }

    /** Drop anything that could be redone, for changes that are not snapshotted themselves. */
    public void discardRedo() {
        redoStack.clear();
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
