package io.sheetcompiler.core.model;

/** Axis along which a group's members are laid out. */
public enum GroupDirection {
    /** Same column, consecutive rows; the loop variable is the row. */
    VERTICAL,
    /** Same row, consecutive columns; the loop variable is the column. */
    HORIZONTAL
}
