package io.sheetcompiler.runtime;

import java.util.Set;

/**
 * Contract of a generated program. The compiler emits one class implementing this interface
 * per converted workbook.
 */
public interface CompiledWorkbook {

    /** External workbook file names the program reads, as written in its formulas. */
    Set<String> externalFiles();

    /**
     * Runs the whole calculation: loads external sheets, seeds hardcoded cells, then
     * evaluates every formula cell in dependency order. Never throws for a failing cell.
     */
    void compute(CellStore store, ExternalWorkbooks externals);

    /** Creates a store over {@code inputs}, computes into it, and returns it. */
    default CellStore run(InputValues inputs, ExternalWorkbooks externals) {
        CellStore store = new CellStore(inputs);
        compute(store, externals);
        return store;
    }
}
