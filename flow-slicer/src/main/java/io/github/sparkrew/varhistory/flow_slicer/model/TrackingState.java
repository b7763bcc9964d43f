package io.github.sparkrew.varhistory.flow_slicer.model;

import java.util.*;

/**
 * Slicing metadata of one node. Appended to during a single backward pass, cleared before the next one.
 */
public class TrackingState {

    private final Set<String> tracking = new LinkedHashSet<>();
    private final List<VarAppearance> varAppearances = new ArrayList<>();
    private final List<VarModification> varModifications = new ArrayList<>();
    private final List<VarSwitch> varSwitches = new ArrayList<>();
    private boolean relevantReturn;

    Set<String> tracking() {
        return tracking;
    }

    List<VarAppearance> varAppearances() {
        return varAppearances;
    }

    List<VarModification> varModifications() {
        return varModifications;
    }

    List<VarSwitch> varSwitches() {
        return varSwitches;
    }

    boolean relevantReturn() {
        return relevantReturn;
    }

    void markRelevantReturn() {
        relevantReturn = true;
    }

    boolean isEmpty() {
        return tracking.isEmpty() && varAppearances.isEmpty() && varModifications.isEmpty()
                && varSwitches.isEmpty() && !relevantReturn;
    }

    void clear() {
        tracking.clear();
        varAppearances.clear();
        varModifications.clear();
        varSwitches.clear();
        relevantReturn = false;
    }
}
