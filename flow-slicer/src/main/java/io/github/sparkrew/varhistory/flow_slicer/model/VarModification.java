package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * An identifier whose value differs between two snapshots of the same frame.
 */
public record VarModification(String id, Object oldValue, Object newValue) {
}
