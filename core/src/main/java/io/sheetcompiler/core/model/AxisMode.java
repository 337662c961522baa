package io.sheetcompiler.core.model;

/** Whether one axis of a coordinate is anchored with {@code $} or moves when the formula is copied. */
public enum AxisMode {
    ABSOLUTE,
    RELATIVE
}
