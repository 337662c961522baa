package io.sheetcompiler.core.config;

import java.util.Objects;
import javax.lang.model.SourceVersion;

/**
 * Settings of one conversion. Use {@link #builder()}; every field has a default.
 *
 * @param packageName                       package of the generated class
 * @param className                         simple name of the generated class
 * @param deleteUnreferencedHardcodedValues seed only hardcoded cells that some formula reads
 * @param statementsPerMethod               statements per generated {@code stepN} method
 */
public record ConverterConfig(
        String packageName, String className, boolean deleteUnreferencedHardcodedValues, int statementsPerMethod) {

    public static final ConverterConfig DEFAULT = builder().build();

    public ConverterConfig {
        Objects.requireNonNull(packageName, "packageName must not be null");
        Objects.requireNonNull(className, "className must not be null");
        if (!packageName.isEmpty() && !SourceVersion.isName(packageName)) {
            throw new IllegalArgumentException("not a valid Java package name: '" + packageName + "'");
        }
        if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
            throw new IllegalArgumentException("not a valid Java class name: '" + className + "'");
        }
        if (statementsPerMethod < 1) {
            throw new IllegalArgumentException("statementsPerMethod must be positive, got " + statementsPerMethod);
        }
    }

    /** Fully qualified name of the generated class. */
    public String qualifiedClassName() {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .packageName(packageName)
                .className(className)
                .deleteUnreferencedHardcodedValues(deleteUnreferencedHardcodedValues)
                .statementsPerMethod(statementsPerMethod);
    }

    /** Builder with the documented defaults. */
    public static final class Builder {
        private String packageName = "generated.workbook";
        private String className = "WorkbookCalculation";
        private boolean deleteUnreferencedHardcodedValues;
        private int statementsPerMethod = 250;

        Builder() {}

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder deleteUnreferencedHardcodedValues(boolean deleteUnreferencedHardcodedValues) {
            this.deleteUnreferencedHardcodedValues = deleteUnreferencedHardcodedValues;
            return this;
        }

        public Builder statementsPerMethod(int statementsPerMethod) {
            this.statementsPerMethod = statementsPerMethod;
            return this;
        }

        public ConverterConfig build() {
            return new ConverterConfig(packageName, className, deleteUnreferencedHardcodedValues, statementsPerMethod);
        }
    }
}
