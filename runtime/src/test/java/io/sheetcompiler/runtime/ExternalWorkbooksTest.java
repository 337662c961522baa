package io.sheetcompiler.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ExternalWorkbooks path configuration")
class ExternalWorkbooksTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("blank paths mean not provided, relative paths resolve against the config file")
    void readsPathConfiguration() throws IOException {
        Path config = tempDir.resolve("input_files_config.json");
        Files.writeString(config, """
                {
                  "Ext.xlsx": "data/ext.xlsx",
                  "Other.xlsx": "  ",
                  "Absolute.xlsx": "%s"
                }
                """.formatted(tempDir.resolve("abs.xlsx").toAbsolutePath().toString().replace("\\", "\\\\")));

        ExternalWorkbooks externals = ExternalWorkbooks.fromConfig(config, (path, sheet) -> Map.of());

        assertThat(externals.pathOf("Ext.xlsx")).contains(tempDir.toAbsolutePath().resolve("data/ext.xlsx"));
        assertThat(externals.pathOf("Other.xlsx")).isEmpty();
        assertThat(externals.pathOf("Absolute.xlsx")).contains(tempDir.resolve("abs.xlsx").toAbsolutePath());
        assertThat(externals.pathOf("Unknown.xlsx")).isEmpty();
    }

    @Test
    @DisplayName("a document that is not an object is rejected")
    void rejectsNonObject() throws IOException {
        Path config = tempDir.resolve("paths.json");
        Files.writeString(config, "[\"Ext.xlsx\"]");

        assertThatThrownBy(() -> ExternalWorkbooks.fromConfig(config, (path, sheet) -> Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be a JSON object");
    }

    @Test
    @DisplayName("malformed JSON → UncheckedIOException")
    void malformedJson() throws IOException {
        Path config = tempDir.resolve("paths.json");
        Files.writeString(config, "{ not json");

        assertThatThrownBy(() -> ExternalWorkbooks.fromConfig(config, (path, sheet) -> Map.of()))
                .isInstanceOf(UncheckedIOException.class);
    }
}
