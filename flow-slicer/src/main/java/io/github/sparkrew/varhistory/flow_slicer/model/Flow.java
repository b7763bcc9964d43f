package io.github.sparkrew.varhistory.flow_slicer.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The whole flow graph of one trace: where it starts, and the target the backward slice starts from.
 * <p>
 * The first node of the root frame has no predecessor. That null is the ROOT sentinel the slicer stops at.
 */
public record Flow(Node start, Node target, String targetIdentifier) {

    /**
     * All nodes in execution order: a node, then the nodes of the call it makes, then its successor.
     */
    public List<Node> nodes() {
        List<Node> ordered = new ArrayList<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            ordered.add(node);
            if (node.next() != null) {
                pending.push(node.next());
            }
            if (node.stepInto() != null) {
                pending.push(node.stepInto());
            }
        }
        return ordered;
    }

    public void resetTracking() {
        nodes().forEach(Node::clearTracking);
    }

    public static boolean isRoot(Node node) {
        return node == null;
    }
}
