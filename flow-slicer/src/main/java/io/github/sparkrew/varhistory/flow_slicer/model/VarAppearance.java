package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * An identifier seen for the first time when walking backward: no value existed in the earlier snapshot.
 */
public record VarAppearance(String id, Object value) {
}
