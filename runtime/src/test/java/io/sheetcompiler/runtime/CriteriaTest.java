package io.sheetcompiler.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.function.Predicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Criteria")
class CriteriaTest {

    @Test
    @DisplayName("ordering operators compare numbers only")
    void numericOperators() {
        Predicate<Object> gt5 = Criteria.parse(">5");
        assertThat(gt5.test(6.0)).isTrue();
        assertThat(gt5.test(5.0)).isFalse();
        assertThat(gt5.test("9")).isFalse();
        assertThat(gt5.test(null)).isFalse();
        assertThat(Criteria.parse("<=2.5").test(2.5)).isTrue();
    }

    @Test
    @DisplayName("plain number matches numbers and numeric text")
    void plainNumber() {
        Predicate<Object> five = Criteria.parse(5.0);
        assertThat(five.test(5L)).isTrue();
        assertThat(five.test("5")).isTrue();
        assertThat(five.test(6.0)).isFalse();
    }

    @Test
    @DisplayName("text equality is case-insensitive and supports wildcards")
    void textAndWildcards() {
        assertThat(Criteria.parse("apple").test("APPLE")).isTrue();
        assertThat(Criteria.parse("=ap*").test("Apricot")).isTrue();
        assertThat(Criteria.parse("b?t").test("bat")).isTrue();
        assertThat(Criteria.parse("b?t").test("boat")).isFalse();
        assertThat(Criteria.parse("~*").test("*")).isTrue();
        assertThat(Criteria.parse("~*").test("x")).isFalse();
    }

    @Test
    @DisplayName("<> matches everything that is not equal, blanks included")
    void notEqual() {
        Predicate<Object> notApple = Criteria.parse("<>apple");
        assertThat(notApple.test("pear")).isTrue();
        assertThat(notApple.test(null)).isTrue();
        assertThat(notApple.test("Apple")).isFalse();
        assertThat(Criteria.parse("<>3").test(4.0)).isTrue();
        assertThat(Criteria.parse("<>3").test(3.0)).isFalse();
    }

    @Test
    @DisplayName("empty operand selects blank or non-blank cells")
    void blankCriteria() {
        assertThat(Criteria.parse("=").test(null)).isTrue();
        assertThat(Criteria.parse("=").test("x")).isFalse();
        assertThat(Criteria.parse("<>").test("x")).isTrue();
        assertThat(Criteria.parse("<>").test(null)).isFalse();
        assertThat(Criteria.parse("").test("")).isTrue();
    }

    @Test
    @DisplayName("logical criteria match logicals")
    void logicals() {
        assertThat(Criteria.parse(true).test(true)).isTrue();
        assertThat(Criteria.parse("TRUE").test(true)).isTrue();
        assertThat(Criteria.parse("TRUE").test(1.0)).isFalse();
    }
}
