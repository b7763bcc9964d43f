package io.github.sparkrew.varhistory.flow_slicer.utils;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * A statement text together with its syntax tree, when it could be parsed.
 * <p>
 * {@code parsedText} is what was actually handed to the parser. It starts at offset {@code shift} of {@code text}
 * and may carry a recovery suffix past the end of {@code text}. {@link #span(Node)} maps AST ranges back to offsets
 * in {@code text}.
 */
public record ParsedStatement(String text, String parsedText, int shift, Statement ast) {

    public static ParsedStatement opaque(String text) {
        return new ParsedStatement(text, text, 0, null);
    }

    public boolean isOpaque() {
        return ast == null;
    }

    /**
     * Start (inclusive) and end (exclusive) offsets of the node within {@code text}, or null if the node has no range.
     */
    public int[] span(Node node) {
        Range range = node.getRange().orElse(null);
        if (range == null) {
            return null;
        }
        List<Integer> lineStarts = lineStarts(parsedText);
        int start = offsetOf(range.begin, lineStarts) + shift;
        int end = offsetOf(range.end, lineStarts) + 1 + shift;
        return new int[]{Math.min(start, text.length()), Math.min(end, text.length())};
    }

    private static int offsetOf(Position position, List<Integer> lineStarts) {
        return lineStarts.get(position.line - 1) + position.column - 1;
    }

    private static List<Integer> lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }
}
