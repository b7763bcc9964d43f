package io.github.sparkrew.varhistory.flow_slicer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Identifies one activation of a callable as a path of child indices from the root frame.
 * <p>
 * The root frame is {@code 0}. Its first call is {@code 0.0}, the second call made by that frame is {@code 0.0.1},
 * and so on. Calling the same function twice gives two different ids, so an id is only meaningful relative to its
 * parent. Ancestry is a path-prefix check.
 */
public record FrameId(List<Integer> path) implements Comparable<FrameId> {

    private static final FrameId ROOT = new FrameId(List.of(0));

    public FrameId {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Frame id path must not be empty");
        }
        path = List.copyOf(path);
    }

    public static FrameId root() {
        return ROOT;
    }

    public static FrameId of(Integer... indices) {
        return new FrameId(List.of(indices));
    }

    /**
     * Parse the dotted form produced by {@link #toString()}, e.g. "0.0.1".
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FrameId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Frame id text must not be blank");
        }
        List<Integer> indices = new ArrayList<>();
        for (String part : text.trim().split("\\.")) {
            try {
                indices.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed frame id: " + text, e);
            }
        }
        return new FrameId(indices);
    }

    public FrameId child(int index) {
        List<Integer> childPath = new ArrayList<>(path);
        childPath.add(index);
        return new FrameId(childPath);
    }

    /**
     * The parent frame, or null for a frame of depth 1.
     */
    public FrameId parent() {
        if (path.size() == 1) {
            return null;
        }
        return new FrameId(path.subList(0, path.size() - 1));
    }

    public int depth() {
        return path.size();
    }

    public int childIndex() {
        return path.get(path.size() - 1);
    }

    public boolean isChildOf(FrameId other) {
        return other != null && path.size() == other.path.size() + 1 && other.isAncestorOf(this);
    }

    public boolean isParentOf(FrameId other) {
        return other != null && other.isChildOf(this);
    }

    /**
     * True when this frame is a strict ancestor of the other one.
     */
    public boolean isAncestorOf(FrameId other) {
        return other != null
                && other.path.size() > path.size()
                && other.path.subList(0, path.size()).equals(path);
    }

    @Override
    public int compareTo(FrameId other) {
        int common = Math.min(path.size(), other.path.size());
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(path.get(i), other.path.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(path.size(), other.path.size());
    }

    @JsonValue
    @Override
    public String toString() {
        return path.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
