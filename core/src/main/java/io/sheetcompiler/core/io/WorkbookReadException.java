package io.sheetcompiler.core.io;

/** Thrown when a workbook description is unreadable or structurally invalid. */
public final class WorkbookReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public WorkbookReadException(String message, String source) {
        super(message + " (" + source + ")");
        this.source = source;
    }

    public WorkbookReadException(String message, Throwable cause, String source) {
        super(message + " (" + source + ")", cause);
        this.source = source;
    }

    /** The file or label the description was read from. */
    public String source() {
        return source;
    }
}
