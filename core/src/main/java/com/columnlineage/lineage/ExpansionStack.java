package com.columnlineage.lineage;

import com.columnlineage.exception.CyclicDefinitionException;
import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The view and cache definitions currently being inlined, innermost on top.
 *
 * <p>Keys are the catalog name of a view or the cache key of a cached
 * relation. Pushing a key that is already on the stack is a cycle.
 */
final class ExpansionStack {

    private final Deque<Frame> frames = new ArrayDeque<>();

    /**
     * Enters a definition.
     *
     * @param key the definition's identity
     * @param label how the definition appears in the expansion path
     * @param leaf the leaf being inlined
     * @throws CyclicDefinitionException if the definition is already being inlined
     */
    void push(Object key, String label, LogicalPlan leaf) {
        for (Frame frame : frames) {
            if (frame.key.equals(key)) {
                List<String> path = path();
                path.add(label);
                throw new CyclicDefinitionException(path, leaf);
            }
        }
        frames.push(new Frame(key, label));
    }

    void pop() {
        frames.pop();
    }

    int depth() {
        return frames.size();
    }

    private List<String> path() {
        List<String> path = new ArrayList<>(frames.size() + 1);
        Iterator<Frame> outermostFirst = frames.descendingIterator();
        while (outermostFirst.hasNext()) {
            path.add(outermostFirst.next().label);
        }
        return path;
    }

    private static final class Frame {
        private final Object key;
        private final String label;

        private Frame(Object key, String label) {
            this.key = key;
            this.label = label;
        }
    }
}
