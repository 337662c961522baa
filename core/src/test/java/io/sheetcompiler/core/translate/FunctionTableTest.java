package io.sheetcompiler.core.translate;

import static org.assertj.core.api.Assertions.assertThat;

import io.sheetcompiler.runtime.Functions;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("FunctionTable")
class FunctionTableTest {

    static Stream<FunctionTable.Entry> entries() {
        return FunctionTable.entries().values().stream();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("entries")
    @DisplayName("every accepted argument count has a matching runtime method")
    void runtimeMethodExists(FunctionTable.Entry entry) {
        int highest = Math.min(entry.maxArity(), entry.minArity() + 3);
        for (int arity = entry.minArity(); arity <= highest; arity++) {
            int count = arity;
            boolean found = Arrays.stream(Functions.class.getMethods())
                    .filter(m -> Modifier.isStatic(m.getModifiers()))
                    .filter(m -> m.getName().equals(entry.javaMethod()))
                    .anyMatch(m -> accepts(m, count, entry.kind()));
            assertThat(found)
                    .as("Functions.%s accepting %d arguments", entry.javaMethod(), count)
                    .isTrue();
        }
    }

    private static boolean accepts(Method method, int arity, FunctionTable.Kind kind) {
        if (kind == FunctionTable.Kind.POSITION) {
            return method.getParameterCount() == 1 && method.getParameterTypes()[0] == int.class;
        }
        if (method.isVarArgs()) {
            return arity >= method.getParameterCount() - 1;
        }
        return method.getParameterCount() == arity;
    }

    @Test
    @DisplayName("lookup is by normalised name only")
    void lookup() {
        assertThat(FunctionTable.lookup("SUM")).hasValueSatisfying(e -> {
            assertThat(e.javaMethod()).isEqualTo("sum");
            assertThat(e.rangeArguments()).isTrue();
        });
        assertThat(FunctionTable.lookup("sum")).isEmpty();
        assertThat(FunctionTable.lookup("OFFSET")).isEmpty();
    }

    @Test
    @DisplayName("arity descriptions read naturally")
    void arityDescription() {
        assertThat(FunctionTable.lookup("ROUND").orElseThrow().arityDescription()).isEqualTo("2 arguments");
        assertThat(FunctionTable.lookup("ABS").orElseThrow().arityDescription()).isEqualTo("1 argument");
        assertThat(FunctionTable.lookup("SUM").orElseThrow().arityDescription()).isEqualTo("at least 1 argument");
        assertThat(FunctionTable.lookup("VLOOKUP").orElseThrow().arityDescription()).isEqualTo("3 to 4 arguments");
        assertThat(FunctionTable.lookup("ROW").orElseThrow().accepts(0)).isTrue();
        assertThat(FunctionTable.lookup("ROW").orElseThrow().accepts(2)).isFalse();
    }
}
