package io.sheetcompiler.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the cached cell values of one sheet of an external workbook. Implemented by the
 * workbook I/O collaborator; the runtime never reads spreadsheet containers itself.
 */
@FunctionalInterface
public interface ExternalSheetLoader {

    /**
     * Loads the non-blank cells of a sheet.
     *
     * @param workbook path of the external workbook on disk
     * @param sheet    sheet name inside that workbook
     * @return values keyed by {@link CellKey} whose {@code sheet} is {@code sheet} (the store
     *     re-keys them under the composite identifier); an empty map if the sheet does not exist
     * @throws IOException if the file cannot be read
     */
    Map<CellKey, Object> load(Path workbook, String sheet) throws IOException;
}
