package io.sheetcompiler.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Spreadsheet operator semantics that differ from Java's defaults. */
@DisplayName("Operators")
class OperatorsTest {

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("blank operands act as zero")
        void blankIsZero() {
            assertThat(Operators.add(null, 3.0)).isEqualTo(3.0);
            assertThat(Operators.multiply(null, 3.0)).isEqualTo(0.0);
            assertThat(Operators.subtract(10L, null)).isEqualTo(10.0);
        }

        @Test
        @DisplayName("numeric text and logicals coerce to numbers")
        void coercesNumericTextAndLogicals() {
            assertThat(Operators.add("2.5", 1.0)).isEqualTo(3.5);
            assertThat(Operators.add(" 4 ", true)).isEqualTo(5.0);
            assertThat(Operators.multiply("50%", 10.0)).isEqualTo(5.0);
        }

        @Test
        @DisplayName("non-numeric text → #VALUE!")
        void nonNumericTextIsValueError() {
            assertThat(Operators.add("abc", 1.0)).isEqualTo(ExcelError.VALUE);
            assertThat(Operators.negate("x")).isEqualTo(ExcelError.VALUE);
        }

        @Test
        @DisplayName("division by zero or blank → #DIV/0!")
        void divisionByZero() {
            assertThat(Operators.divide(1.0, 0.0)).isEqualTo(ExcelError.DIV_ZERO);
            assertThat(Operators.divide(1.0, null)).isEqualTo(ExcelError.DIV_ZERO);
            assertThat(Operators.divide(9.0, 3.0)).isEqualTo(3.0);
        }

        @Test
        @DisplayName("leftmost error propagates")
        void leftmostErrorPropagates() {
            assertThat(Operators.add(ExcelError.NA, ExcelError.DIV_ZERO)).isEqualTo(ExcelError.NA);
            assertThat(Operators.subtract(1.0, ExcelError.REF)).isEqualTo(ExcelError.REF);
        }

        @Test
        @DisplayName("power edge cases follow the spreadsheet")
        void powerEdgeCases() {
            assertThat(Operators.power(2.0, 10.0)).isEqualTo(1024.0);
            assertThat(Operators.power(0.0, 0.0)).isEqualTo(ExcelError.NUM);
            assertThat(Operators.power(0.0, -1.0)).isEqualTo(ExcelError.DIV_ZERO);
            assertThat(Operators.power(-8.0, 0.5)).isEqualTo(ExcelError.NUM);
        }

        @Test
        @DisplayName("percent and unary minus")
        void unaryOperators() {
            assertThat(Operators.percent(25.0)).isEqualTo(0.25);
            assertThat(Operators.negate(2.0)).isEqualTo(-2.0);
            assertThat(Operators.negate("3")).isEqualTo(-3.0);
        }

        @Test
        @DisplayName("a multi-cell area in scalar position → #VALUE!")
        void areaInScalarPosition() {
            Area area = new Area(2, 1, List.of(1.0, 2.0));
            assertThat(Operators.add(area, 1.0)).isEqualTo(ExcelError.VALUE);
            assertThat(Operators.add(new Area(1, 1, List.of(4.0)), 1.0)).isEqualTo(5.0);
        }
    }

    @Nested
    @DisplayName("concatenation")
    class Concatenation {

        @Test
        @DisplayName("integral numbers print without a fraction")
        void integralNumbers() {
            assertThat(Operators.concat(3.0, "x")).isEqualTo("3x");
            assertThat(Operators.concat(2.5, 10L)).isEqualTo("2.510");
        }

        @Test
        @DisplayName("logicals print as TRUE/FALSE and blanks as empty text")
        void logicalsAndBlanks() {
            assertThat(Operators.concat(true, null)).isEqualTo("TRUE");
            assertThat(Operators.concat(null, false)).isEqualTo("FALSE");
        }

        @Test
        @DisplayName("errors propagate")
        void errorsPropagate() {
            assertThat(Operators.concat("a", ExcelError.NAME)).isEqualTo(ExcelError.NAME);
        }
    }

    @Nested
    @DisplayName("comparison")
    class Comparison {

        @Test
        @DisplayName("text compares case-insensitively")
        void caseInsensitiveText() {
            assertThat(Operators.eq("Apple", "APPLE")).isEqualTo(true);
            assertThat(Operators.lt("apple", "Banana")).isEqualTo(true);
        }

        @Test
        @DisplayName("numbers < text < logicals")
        void typeOrdering() {
            assertThat(Operators.lt(1000.0, "a")).isEqualTo(true);
            assertThat(Operators.gt(false, "zzz")).isEqualTo(true);
            assertThat(Operators.eq(1.0, "1")).isEqualTo(false);
        }

        @Test
        @DisplayName("blank equals zero, empty text and FALSE")
        void blankTakesOtherSidesEmptyValue() {
            assertThat(Operators.eq(null, 0.0)).isEqualTo(true);
            assertThat(Operators.eq(null, "")).isEqualTo(true);
            assertThat(Operators.eq(null, false)).isEqualTo(true);
            assertThat(Operators.ne(null, 1.0)).isEqualTo(true);
        }

        @Test
        @DisplayName("integer and floating values compare numerically")
        void mixedNumericTypes() {
            assertThat(Operators.eq(3L, 3.0)).isEqualTo(true);
            assertThat(Operators.ge(3L, 2.5)).isEqualTo(true);
            assertThat(Operators.le(3L, 2.5)).isEqualTo(false);
        }

        @Test
        @DisplayName("errors propagate instead of comparing")
        void errorsPropagate() {
            assertThat(Operators.eq(ExcelError.NA, ExcelError.NA)).isEqualTo(ExcelError.NA);
        }
    }
}
