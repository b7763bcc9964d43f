package io.github.sparkrew.varhistory.flow_slicer.utils;

import io.github.sparkrew.varhistory.flow_slicer.model.FrameId;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Assigns frame ids while replaying a flat stream of calls and returns.
 * Owned by its caller; not thread-safe.
 */
public class FrameTracker {

    private final Deque<FrameId> stack = new ArrayDeque<>();
    // Next child index per frame
    private final Map<FrameId, Integer> childCounts = new HashMap<>();

    public FrameTracker() {
        this(FrameId.root());
    }

    public FrameTracker(FrameId root) {
        stack.push(root);
    }

    public FrameId current() {
        return stack.peek();
    }

    public int depth() {
        return stack.size();
    }

    /**
     * Enter a new child of the current frame.
     *
     * @return the id of the entered frame
     */
    public FrameId enterCall() {
        FrameId parent = current();
        int index = childCounts.getOrDefault(parent, 0);
        childCounts.put(parent, index + 1);
        FrameId child = parent.child(index);
        stack.push(child);
        return child;
    }

    /**
     * Leave the current frame.
     *
     * @return the id of the frame control returns to
     */
    public FrameId exitCall() {
        if (stack.size() == 1) {
            throw new IllegalStateException("Cannot exit the root frame " + current());
        }
        stack.pop();
        return current();
    }
}
