package io.sheetcompiler.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConfigLoader}: YAML fixtures from the classpath, defaults for missing keys,
 * the environment overlay and the error paths.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Nested
    @DisplayName("YAML files")
    class YamlFiles {

        @Test
        @DisplayName("minimal config sets the class name and keeps every other default")
        void minimal() throws Exception {
            ConverterConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.className()).isEqualTo("Budget2024");
            assertThat(config.packageName()).isEqualTo("generated.workbook");
            assertThat(config.statementsPerMethod()).isEqualTo(250);
            assertThat(config.deleteUnreferencedHardcodedValues()).isFalse();
        }

        @Test
        @DisplayName("full config populates every field")
        void full() throws Exception {
            ConverterConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config).isEqualTo(new ConverterConfig("com.acme.finance", "ForecastModel", true, 100));
            assertThat(config.qualifiedClassName()).isEqualTo("com.acme.finance.ForecastModel");
        }

        @Test
        @DisplayName("an empty document yields the defaults")
        void empty() throws Exception {
            assertThat(ConfigLoader.load(fixture("empty-config.yaml"), NO_ENV)).isEqualTo(ConverterConfig.DEFAULT);
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        @Test
        @DisplayName("variables win over YAML values")
        void overridesYaml() throws Exception {
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_CLASS_NAME, "FromEnv",
                    ConfigLoader.ENV_STATEMENTS_PER_METHOD, " 40 ",
                    ConfigLoader.ENV_DELETE_UNREFERENCED, "false");

            ConverterConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.className()).isEqualTo("FromEnv");
            assertThat(config.packageName()).isEqualTo("com.acme.finance");
            assertThat(config.statementsPerMethod()).isEqualTo(40);
            assertThat(config.deleteUnreferencedHardcodedValues()).isFalse();
        }

        @Test
        @DisplayName("blank variables count as unset")
        void blankIgnored() {
            ConverterConfig config = ConfigLoader.fromEnvironment(Map.of(ConfigLoader.ENV_PACKAGE_NAME, "  ")::get);

            assertThat(config.packageName()).isEqualTo("generated.workbook");
        }

        @Test
        @DisplayName("a non-numeric method size names the variable")
        void badInteger() {
            assertThatThrownBy(() ->
                            ConfigLoader.fromEnvironment(Map.of(ConfigLoader.ENV_STATEMENTS_PER_METHOD, "many")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("SHEETC_STATEMENTS_PER_METHOD")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("a missing file is reported with its path")
        void missingFile() {
            Path missing = Path.of("does-not-exist.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: does-not-exist.yaml");
        }

        @Test
        @DisplayName("malformed YAML is wrapped")
        void malformed() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("malformed.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }

        @Test
        @DisplayName("a class name that is not a Java identifier is rejected")
        void invalidClassName() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("invalid-class-name.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not a valid Java class name: '2024-Budget'");
        }

        @Test
        @DisplayName("a keyword cannot be the class name")
        void keywordClassName() {
            assertThatThrownBy(() -> ConverterConfig.builder().className("class").build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ConverterConfig.builder().statementsPerMethod(0).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must be positive");
        }
    }
}
