package io.sheetcompiler.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes conversion artefacts as pretty-printed JSON or plain text. */
public final class ReportWriter {

    /** Name of the external path configuration the generated program reads. */
    public static final String PATH_CONFIG_FILE = "input_files_config.json";

    public static final String REPORT_FILE = "conversion_report.json";

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        this(new ObjectMapper());
    }

    public ReportWriter(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path writeReport(ConversionReport report, Path directory) {
        return writeJson(report, directory.resolve(REPORT_FILE));
    }

    public Path writeManifest(ExternalFileManifest manifest, Path directory) {
        return writeJson(manifest.toPathConfig(), directory.resolve(PATH_CONFIG_FILE));
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }

    public Path writeJson(Object value, Path file) {
        return writeText(toJson(value) + System.lineSeparator(), file);
    }

    public Path writeText(String text, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        LOG.info("Wrote {}", file);
        return file;
    }
}
