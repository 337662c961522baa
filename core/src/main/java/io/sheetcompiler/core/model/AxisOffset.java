package io.sheetcompiler.core.model;

/** One element of a pattern signature: how one axis of one reference is positioned. */
public sealed interface AxisOffset {

    /** Distance from the owning cell along this axis. */
    record Relative(int delta) implements AxisOffset {
        @Override
        public String toString() {
            return delta >= 0 ? "+" + delta : Integer.toString(delta);
        }
    }

    /** Fixed coordinate along this axis. */
    record Absolute(int coordinate) implements AxisOffset {
        @Override
        public String toString() {
            return "$" + coordinate;
        }
    }
}
