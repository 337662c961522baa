package io.sheetcompiler.core.error;

import io.sheetcompiler.core.report.ConversionReport;
import java.util.List;

/**
 * Thrown after the parse pass when one or more formulas failed to parse. Conversion catalogues
 * every failure before aborting, so a single run shows all of them.
 */
public final class InvalidFormulasException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final transient List<FormulaParseException> failures;
    private final transient ConversionReport report;

    public InvalidFormulasException(List<FormulaParseException> failures, ConversionReport report) {
        super(summary(failures), failures.get(0).cell(), failures.get(0).formula(), Stage.PARSE);
        this.failures = List.copyOf(failures);
        this.report = report;
        failures.forEach(this::addSuppressed);
    }

    /** Every parse failure, in cell order. */
    public List<FormulaParseException> failures() {
        return failures;
    }

    /** Analysis of the workbook with the failures listed as diagnostics. */
    public ConversionReport report() {
        return report;
    }

    private static String summary(List<FormulaParseException> failures) {
        StringBuilder message = new StringBuilder()
                .append(failures.size())
                .append(failures.size() == 1 ? " formula" : " formulas")
                .append(" could not be parsed:");
        for (FormulaParseException failure : failures) {
            message.append(System.lineSeparator()).append("  ").append(failure.getMessage());
        }
        return message.toString();
    }
}
