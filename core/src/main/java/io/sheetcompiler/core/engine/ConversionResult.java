package io.sheetcompiler.core.engine;

import io.sheetcompiler.core.config.ConverterConfig;
import io.sheetcompiler.core.report.ConversionReport;
import io.sheetcompiler.core.report.ExternalFileManifest;
import io.sheetcompiler.core.report.ReportWriter;
import io.sheetcompiler.core.schedule.Schedule;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything one conversion produces.
 *
 * @param config   the settings used
 * @param source   Java source of the generated class
 * @param manifest external workbooks the program reads
 * @param report   the analysis report
 * @param schedule the evaluation order the source follows
 */
public record ConversionResult(
        ConverterConfig config,
        String source,
        ExternalFileManifest manifest,
        ConversionReport report,
        Schedule schedule) {

    public ConversionResult {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(schedule, "schedule");
    }

    public String qualifiedClassName() {
        return config.qualifiedClassName();
    }

    /** Path of the source file relative to a source root, e.g. {@code generated/workbook/WorkbookCalculation.java}. */
    public Path sourcePath() {
        return Path.of(qualifiedClassName().replace('.', '/') + ".java");
    }

    /**
     * Writes the source below {@code directory} in its package folders, plus the external path
     * configuration and the report next to it.
     *
     * @return the written source file
     */
    public Path writeTo(Path directory, ReportWriter writer) {
        Path sourceFile = writer.writeText(source, directory.resolve(sourcePath()));
        writer.writeManifest(manifest, directory);
        writer.writeReport(report, directory);
        return sourceFile;
    }

    public Path writeTo(Path directory) {
        return writeTo(directory, new ReportWriter());
    }
}
