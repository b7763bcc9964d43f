package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * Kind of a recorded execution event.
 */
public enum EventKind {
    LINE,
    CALL,
    RETURN
}
