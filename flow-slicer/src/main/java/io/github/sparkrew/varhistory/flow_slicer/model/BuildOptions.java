package io.github.sparkrew.varhistory.flow_slicer.model;

import io.github.sparkrew.varhistory.flow_slicer.CalleeResolver;

/**
 * Options of the flow builder.
 *
 * @param marker   name of the method whose single argument names the target identifier
 * @param resolver source lookup for callees the records describe incompletely
 */
public record BuildOptions(String marker, CalleeResolver resolver) {

    public static final String DEFAULT_MARKER = "register";

    public BuildOptions {
        marker = marker == null || marker.isBlank() ? DEFAULT_MARKER : marker;
        resolver = resolver == null ? CalleeResolver.NONE : resolver;
    }

    public static BuildOptions defaults() {
        return new BuildOptions(DEFAULT_MARKER, CalleeResolver.NONE);
    }
}
