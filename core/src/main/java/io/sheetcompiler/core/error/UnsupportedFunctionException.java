package io.sheetcompiler.core.error;

import io.sheetcompiler.core.model.CellAddress;

/** Thrown when a formula calls a function the compiler has no translation for. Always fatal. */
public final class UnsupportedFunctionException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final String function;

    public UnsupportedFunctionException(String function, CellAddress cell, String formula) {
        super(String.format("%s: unsupported function %s in '%s'", cell, function, formula), cell, formula,
                Stage.TRANSLATE);
        this.function = function;
    }

    public String function() {
        return function;
    }
}
