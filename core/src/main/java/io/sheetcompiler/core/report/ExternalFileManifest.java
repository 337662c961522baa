package io.sheetcompiler.core.report;

import io.sheetcompiler.core.model.Cell.FormulaCell;
import io.sheetcompiler.core.model.Reference;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The external workbooks a program reads: file name as written in formulas, with the sheets
 * read from each. Its {@link #toPathConfig()} form is the file the operator fills with paths
 * before running the program.
 */
public final class ExternalFileManifest {

    private final SortedMap<String, SortedSet<String>> sheetsByFile;

    private ExternalFileManifest(SortedMap<String, SortedSet<String>> sheetsByFile) {
        this.sheetsByFile = sheetsByFile;
    }

    public static ExternalFileManifest of(Collection<FormulaCell> formulas) {
        SortedMap<String, SortedSet<String>> sheets = new TreeMap<>();
        for (FormulaCell formula : formulas) {
            for (Reference reference : formula.references()) {
                if (reference.isExternal()) {
                    sheets.computeIfAbsent(reference.externalFile(), f -> new TreeSet<>()).add(reference.sheet());
                }
            }
        }
        sheets.replaceAll((file, names) -> Collections.unmodifiableSortedSet(names));
        return new ExternalFileManifest(Collections.unmodifiableSortedMap(sheets));
    }

    public SortedSet<String> files() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(sheetsByFile.keySet()));
    }

    /** File name to the sheets read from it. */
    public SortedMap<String, SortedSet<String>> sheets() {
        return sheetsByFile;
    }

    public boolean isEmpty() {
        return sheetsByFile.isEmpty();
    }

    /** Every file name mapped to an empty path, sorted by name. */
    public SortedMap<String, String> toPathConfig() {
        SortedMap<String, String> config = new TreeMap<>();
        sheetsByFile.keySet().forEach(file -> config.put(file, ""));
        return config;
    }
}
