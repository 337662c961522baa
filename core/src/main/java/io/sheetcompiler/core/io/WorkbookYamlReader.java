package io.sheetcompiler.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.sheetcompiler.core.model.CellAddress;
import io.sheetcompiler.core.model.CellRange;
import io.sheetcompiler.core.model.SourceCell;
import io.sheetcompiler.core.model.TableDefinition;
import io.sheetcompiler.core.model.WorkbookModel;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a workbook from a YAML description, for fixtures and for callers without a binary
 * spreadsheet reader.
 *
 * <pre>
 * sheets:
 *   Sheet1:
 *     B2: 10
 *     C2: 4
 *     D2: "=B2-C2"
 *     E2: { formula: "=D2*2", value: 12 }
 *     F2: { date: 2024-01-31 }
 *     G2: { value: "=not a formula" }
 *   Empty: {}
 * tables:
 *   - name: Sales
 *     sheet: Sheet1
 *     ref: A1:C10
 *     columns: [Region, Amount, Date]
 *     headerRows: 1
 *     totalsRows: 0
 * </pre>
 *
 * <p>
 * A plain string starting with {@code =} is a formula; any other scalar is a value. Sheets
 * keep their document order. Unknown keys are rejected.
 */
public final class WorkbookYamlReader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("sheets", "tables");
    private static final Set<String> KNOWN_CELL_KEYS = Set.of("formula", "value", "date");
    private static final Set<String> KNOWN_TABLE_KEYS =
            Set.of("name", "sheet", "ref", "columns", "headerRows", "totalsRows");

    public WorkbookModel read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new WorkbookReadException("Failed to read workbook: " + e.getMessage(), e, path.toString());
        }
    }

    public WorkbookModel read(InputStream in, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new WorkbookReadException("Invalid YAML: " + e.getMessage(), e, source);
        }
        return toModel(root, source);
    }

    public WorkbookModel parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new WorkbookReadException("Invalid YAML: " + e.getMessage(), e, source);
        }
        return toModel(root, source);
    }

    private WorkbookModel toModel(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new WorkbookReadException("Workbook description must be a mapping", source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "workbook", source);
        JsonNode sheets = root.path("sheets");
        if (!sheets.isObject() || sheets.isEmpty()) {
            throw new WorkbookReadException("'sheets' must map at least one sheet name to its cells", source);
        }
        WorkbookModel.Builder builder = WorkbookModel.builder();
        try {
            for (Iterator<Map.Entry<String, JsonNode>> it = sheets.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> sheet = it.next();
                builder.sheet(sheet.getKey());
                readSheet(builder, sheet.getKey(), sheet.getValue(), source);
            }
            JsonNode tables = root.path("tables");
            if (!tables.isMissingNode() && !tables.isNull()) {
                if (!tables.isArray()) {
                    throw new WorkbookReadException("'tables' must be a list", source);
                }
                for (JsonNode table : tables) {
                    builder.table(readTable(table, source));
                }
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkbookReadException(e.getMessage(), e, source);
        }
    }

    private void readSheet(WorkbookModel.Builder builder, String sheet, JsonNode cells, String source) {
        if (cells == null || cells.isNull()) {
            return;
        }
        if (!cells.isObject()) {
            throw new WorkbookReadException("Sheet '" + sheet + "' must map cell addresses to contents", source);
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = cells.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> cell = it.next();
            CellAddress address = CellAddress.parse(sheet, cell.getKey());
            builder.cell(readCell(address, cell.getValue(), source));
        }
    }

    private SourceCell readCell(CellAddress address, JsonNode node, String source) {
        if (node.isTextual() && node.asText().startsWith("=")) {
            return new SourceCell(address, node.asText(), null);
        }
        if (!node.isObject()) {
            return new SourceCell(address, null, scalar(node));
        }
        rejectUnknownKeys(node, KNOWN_CELL_KEYS, "cell " + address, source);
        if (node.has("date")) {
            return new SourceCell(address, null, date(node.get("date").asText(), address, source));
        }
        Object value = node.has("value") ? scalar(node.get("value")) : null;
        if (node.has("formula")) {
            String formula = node.get("formula").asText();
            return new SourceCell(address, formula.startsWith("=") ? formula : "=" + formula, value);
        }
        return new SourceCell(address, null, value);
    }

    private TableDefinition readTable(JsonNode table, String source) {
        rejectUnknownKeys(table, KNOWN_TABLE_KEYS, "table", source);
        String name = requireString(table, "name", source);
        String sheet = requireString(table, "sheet", source);
        CellRange range = CellRange.parse(sheet, requireString(table, "ref", source));
        List<String> columns = new ArrayList<>();
        table.path("columns").forEach(c -> columns.add(c.asText()));
        return new TableDefinition(name, sheet, range, columns, table.path("headerRows").asInt(1),
                table.path("totalsRows").asInt(0));
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    private static Object date(String text, CellAddress address, String source) {
        try {
            return text.contains("T") ? LocalDateTime.parse(text) : LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new WorkbookReadException("Cell " + address + " has an invalid date '" + text + "'", e, source);
        }
    }

    private static String requireString(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new WorkbookReadException("Missing or empty required field '" + field + "'", source);
        }
        return value.asText();
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String where, String source) {
        for (Iterator<String> names = node.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new WorkbookReadException("Unknown key '" + name + "' in " + where + ", expected one of "
                        + known.stream().sorted().toList(), source);
            }
        }
    }
}
