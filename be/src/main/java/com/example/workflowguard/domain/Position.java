package com.example.workflowguard.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Canvas position of a node (top-left corner). Serialized as a two-element JSON array {@code [x, y]}.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public Position {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("position must be finite: [" + x + ", " + y + "]");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Position fromJson(List<Number> xy) {
        if (xy == null || xy.size() != 2 || xy.get(0) == null || xy.get(1) == null) {
            throw new IllegalArgumentException("position must be a pair of numbers");
        }
        return new Position(xy.get(0).doubleValue(), xy.get(1).doubleValue());
    }

    /** Whole coordinates are written as integers so untouched positions round-trip unchanged. */
    @JsonValue
    public List<Number> toJson() {
        return List.of(compact(x), compact(y));
    }

    private static Number compact(double value) {
        if (value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return (long) value;
        }
        return value;
    }
}
