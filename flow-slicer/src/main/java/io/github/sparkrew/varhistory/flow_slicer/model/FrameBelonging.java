package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * What a callee frame belongs to. Decides whether the frame has an implicit {@code this} and how it flows.
 */
public enum FrameBelonging {
    CONSTRUCTOR,
    INSTANCE_METHOD,
    UNKNOWN;

    public boolean bindsThis() {
        return this != UNKNOWN;
    }
}
