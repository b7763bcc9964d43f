package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * @param maxSteps upper bound on backward steps, 0 for no bound
 */
public record SliceOptions(int maxSteps) {

    public SliceOptions {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
        }
    }

    public static SliceOptions unbounded() {
        return new SliceOptions(0);
    }
}
