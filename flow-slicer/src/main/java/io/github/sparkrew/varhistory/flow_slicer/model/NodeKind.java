package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * Kind of a flow node. RETURN events never become nodes, they are folded into the callee's last node.
 */
public enum NodeKind {
    LINE,
    CALL
}
