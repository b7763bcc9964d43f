package io.github.sparkrew.varhistory.flow_slicer.model;

import java.util.List;

/**
 * What the recorder knows about the callable entered by a CALL record.
 * Any field except {@code frame} may be null when the recorder could not tell.
 */
public record CalleeInfo(
        FrameId frame,
        String name,
        List<String> parameters,
        boolean varargs,
        FrameBelonging belonging
) {

    public CalleeInfo {
        parameters = parameters == null ? null : List.copyOf(parameters);
    }

    public static CalleeInfo of(FrameId frame, String name, String... parameters) {
        return new CalleeInfo(frame, name, List.of(parameters), false, null);
    }

    public CalleeInfo withFrame(FrameId newFrame) {
        return new CalleeInfo(newFrame, name, parameters, varargs, belonging);
    }

    public CalleeInfo withBelonging(FrameBelonging newBelonging) {
        return new CalleeInfo(frame, name, parameters, varargs, newBelonging);
    }

    /**
     * Fill in whatever this record lacks from a resolved declaration.
     */
    public CalleeInfo mergeMissing(CalleeInfo resolved) {
        if (resolved == null) {
            return this;
        }
        return new CalleeInfo(
                frame,
                name != null ? name : resolved.name(),
                parameters != null ? parameters : resolved.parameters(),
                parameters != null ? varargs : resolved.varargs(),
                belonging != null ? belonging : resolved.belonging()
        );
    }
}
