package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * A logical source line: the file and the first and last physical lines the statement spans.
 */
public record SourceLocation(String file, int startLine, int endLine) {

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(file, line, line);
    }

    @Override
    public String toString() {
        return startLine == endLine ? file + ":" + startLine : file + ":" + startLine + "-" + endLine;
    }
}
