package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * The same runtime value known under a different name on each side of a call boundary.
 */
public record VarSwitch(String argId, String paramId, Object value) {
}
