package io.sheetcompiler.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Value of a hardcoded cell, restricted to the types a generated program can spell as a
 * literal. Anything else is gated out at the workbook boundary by {@link #gate(Object)}.
 */
public sealed interface LiteralValue {

    LiteralValue NULL = new NullValue();

    /** The value as the runtime stores it: Long, Double, Boolean, String or null. */
    Object toJava();

    record IntegerValue(long value) implements LiteralValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record FloatValue(double value) implements LiteralValue {
        public FloatValue {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("not a finite number: " + value);
            }
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements LiteralValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record TextValue(String value) implements LiteralValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record NullValue() implements LiteralValue {
        @Override
        public Object toJava() {
            return null;
        }
    }

    /**
     * Converts a raw cell value into a literal. Dates become spreadsheet serial numbers.
     *
     * @return the literal, or empty if the value has no literal form (non-finite numbers,
     *     library-internal objects); callers substitute {@link #NULL} and report it
     */
    static Optional<LiteralValue> gate(Object raw) {
        if (raw == null) {
            return Optional.of(NULL);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return Optional.of(new IntegerValue(((Number) raw).longValue()));
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() < 64 ? Optional.of(new IntegerValue(big.longValue())) : finite(big.doubleValue());
        }
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return finite(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean b) {
            return Optional.of(new BooleanValue(b));
        }
        if (raw instanceof String || raw instanceof Character) {
            return Optional.of(new TextValue(raw.toString()));
        }
        if (raw instanceof LocalDateTime dateTime) {
            double fraction = dateTime.toLocalTime().toNanoOfDay() / 86_400e9;
            return Optional.of(new FloatValue(serialDay(dateTime.toLocalDate()) + fraction));
        }
        if (raw instanceof LocalDate date) {
            return Optional.of(new IntegerValue(serialDay(date)));
        }
        return Optional.empty();
    }

    /**
     * Spreadsheet serial number of a date in the 1900 date system, which counts the
     * non-existent 1900-02-29.
     */
    static long serialDay(LocalDate date) {
        LocalDate epoch = date.isBefore(LocalDate.of(1900, 3, 1)) ? LocalDate.of(1899, 12, 31) : LocalDate.of(1899, 12, 30);
        return ChronoUnit.DAYS.between(epoch, date);
    }

    private static Optional<LiteralValue> finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Optional.empty();
        }
        return Optional.of(new FloatValue(value));
    }
}
