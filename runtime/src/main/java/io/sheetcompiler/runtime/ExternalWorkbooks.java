package io.sheetcompiler.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps external workbook names, as written in formulas ({@code [Ext.xlsx]Sheet1!A1}), to files
 * on disk and loads their sheets through an {@link ExternalSheetLoader}.
 *
 * <p>The mapping is normally read from the path configuration file the converter writes
 * next to the generated program: a JSON object of file name to path, where the operator has
 * filled in the paths. Blank paths mean "not provided".
 */
public final class ExternalWorkbooks {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalWorkbooks.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    /** No external workbooks: every external sheet stays empty. */
    public static final ExternalWorkbooks NONE = new ExternalWorkbooks(Map.of(), (path, sheet) -> Map.of());

    private final Map<String, Path> paths;
    private final ExternalSheetLoader loader;

    public ExternalWorkbooks(Map<String, Path> paths, ExternalSheetLoader loader) {
        this.paths = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(paths, "paths")));
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
    }

    /**
     * Reads a path configuration file. Relative paths resolve against the file's directory.
     *
     * @param configFile JSON object mapping file names to paths
     * @param loader     reader for the external workbooks
     * @throws UncheckedIOException     if the file cannot be read or is not valid JSON
     * @throws IllegalArgumentException if the document is not a JSON object of strings
     */
    public static ExternalWorkbooks fromConfig(Path configFile, ExternalSheetLoader loader) {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(configFile.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read external workbook paths from " + configFile, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("External workbook paths in " + configFile + " must be a JSON object");
        }
        Path base = configFile.toAbsolutePath().getParent();
        Map<String, Path> paths = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isTextual() && !value.isNull()) {
                throw new IllegalArgumentException(String.format(
                        "Path for external workbook '%s' in %s must be a string", field.getKey(), configFile));
            }
            String text = value.isNull() ? "" : value.asText().trim();
            if (text.isEmpty()) {
                LOG.debug("No path configured for external workbook '{}'", field.getKey());
                continue;
            }
            Path path = Path.of(text);
            paths.put(field.getKey(), path.isAbsolute() || base == null ? path : base.resolve(path));
        }
        LOG.info("Loaded {} external workbook path(s) from {}", paths.size(), configFile);
        return new ExternalWorkbooks(paths, loader);
    }

    /** The configured path of an external workbook, if one was provided. */
    public Optional<Path> pathOf(String file) {
        return Optional.ofNullable(paths.get(file));
    }

    /**
     * Loads one sheet of an external workbook. A missing mapping, a missing file or a read
     * failure is logged as a warning and yields an empty map.
     */
    Map<CellKey, Object> loadSheet(String file, String sheet) {
        Path path = paths.get(file);
        if (path == null) {
            LOG.warn("No path configured for external workbook '{}'; references to it read as blank", file);
            return Map.of();
        }
        if (!Files.isRegularFile(path)) {
            LOG.warn("External workbook '{}' not found at {}; references to it read as blank", file, path);
            return Map.of();
        }
        try {
            Map<CellKey, Object> cells = loader.load(path, sheet);
            LOG.debug("Loaded {} cell(s) from {} [{}]", cells.size(), path, sheet);
            return cells;
        } catch (IOException e) {
            LOG.warn("Failed to read sheet '{}' of external workbook {}: {}", sheet, path, e.getMessage());
            return Map.of();
        }
    }
}
