package io.sheetcompiler.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CellResult")
class CellResultTest {

    @Test
    @DisplayName("error values are computed results, not failures")
    void errorValueIsComputed() {
        CellResult result = CellResult.of(() -> Operators.divide(1.0, 0.0));

        assertThat(result).isInstanceOf(CellResult.Computed.class);
        assertThat(result.value()).isEqualTo(ExcelError.DIV_ZERO);
    }

    @Test
    @DisplayName("runtime exceptions become Failed with a diagnostic and a null value")
    void exceptionBecomesFailure() {
        CellResult result = CellResult.of(() -> ((String) null).length());

        assertThat(result.isFailure()).isTrue();
        assertThat(result.value()).isNull();
        assertThat(((CellResult.Failed) result).diagnostic()).startsWith("NullPointerException");
    }

    @Test
    @DisplayName("errors other than exceptions are not swallowed")
    void errorsPropagate() {
        assertThatThrownBy(() -> CellResult.of(() -> {
                    throw new AssertionError("not a cell failure");
                }))
                .isInstanceOf(AssertionError.class);
    }
}
