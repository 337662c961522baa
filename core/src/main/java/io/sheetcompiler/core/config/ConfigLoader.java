package io.sheetcompiler.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ConverterConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Recognised keys, all optional:
 *
 * <pre>
 * output:
 *   package: generated.workbook
 *   class-name: WorkbookCalculation
 *   statements-per-method: 250
 * hardcoded-values:
 *   delete-unreferenced: false
 * </pre>
 *
 * <p>
 * Environment variables win over YAML values. A variable counts as set only if it is defined
 * and non-blank after trimming.
 */
public final class ConfigLoader {

    static final String ENV_PACKAGE_NAME = "SHEETC_PACKAGE_NAME";
    static final String ENV_CLASS_NAME = "SHEETC_CLASS_NAME";
    static final String ENV_DELETE_UNREFERENCED = "SHEETC_DELETE_UNREFERENCED_HARDCODED_VALUES";
    static final String ENV_STATEMENTS_PER_METHOD = "SHEETC_STATEMENTS_PER_METHOD";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /** Loads the file and applies overrides from {@link System#getenv}. */
    public static ConverterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * @param envLookup environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static ConverterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return fromTree(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
    }

    /** Defaults plus environment overrides, for runs without a configuration file. */
    public static ConverterConfig fromEnvironment(Function<String, String> envLookup) {
        return fromTree(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static ConverterConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        ConverterConfig.Builder builder = ConverterConfig.builder();

        JsonNode output = root.path("output");
        if (output.has("package")) builder.packageName(output.get("package").asText());
        if (output.has("class-name")) builder.className(output.get("class-name").asText());
        if (output.has("statements-per-method"))
            builder.statementsPerMethod(output.get("statements-per-method").asInt());

        JsonNode hardcoded = root.path("hardcoded-values");
        if (hardcoded.has("delete-unreferenced"))
            builder.deleteUnreferencedHardcodedValues(hardcoded.get("delete-unreferenced").asBoolean());

        envString(envLookup, ENV_PACKAGE_NAME, builder::packageName);
        envString(envLookup, ENV_CLASS_NAME, builder::className);
        envInt(envLookup, ENV_STATEMENTS_PER_METHOD, builder::statementsPerMethod);
        envBool(envLookup, ENV_DELETE_UNREFERENCED, builder::deleteUnreferencedHardcodedValues);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid converter configuration: " + e.getMessage(), e);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " is not an integer: '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
