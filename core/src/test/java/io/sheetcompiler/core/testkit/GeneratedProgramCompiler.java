package io.sheetcompiler.core.testkit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sheetcompiler.core.engine.ConversionResult;
import io.sheetcompiler.runtime.CellStore;
import io.sheetcompiler.runtime.CompiledWorkbook;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.slf4j.LoggerFactory;

/**
 * Compiles a generated program with the system Java compiler and instantiates it, so tests
 * can run what the converter emits.
 */
public final class GeneratedProgramCompiler {

    private final Path workDir;

    public GeneratedProgramCompiler(Path workDir) {
        this.workDir = workDir;
    }

    public CompiledWorkbook compile(ConversionResult result) {
        return compile(result.qualifiedClassName(), result.source());
    }

    public CompiledWorkbook compile(String qualifiedClassName, String source) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No Java compiler available; tests need a JDK");
        }
        try {
            Path sources = Files.createDirectories(workDir.resolve("src"));
            Path classes = Files.createDirectories(workDir.resolve("classes"));
            Path file = sources.resolve(qualifiedClassName.replace('.', '/') + ".java");
            Files.createDirectories(file.getParent());
            Files.writeString(file, source);

            StringWriter errors = new StringWriter();
            try (StandardJavaFileManager fileManager = compiler.getStandardFileManager(null, null, null)) {
                Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjectsFromFiles(List.of(file.toFile()));
                List<String> options = List.of("-d", classes.toString(), "-classpath", classpath());
                boolean success = compiler.getTask(errors, fileManager, null, options, null, units).call();
                if (!success) {
                    throw new AssertionError("Generated program does not compile:\n" + errors + "\n" + source);
                }
            }
            URLClassLoader loader = new URLClassLoader(
                    new URL[] {classes.toUri().toURL()}, GeneratedProgramCompiler.class.getClassLoader());
            Class<?> type = loader.loadClass(qualifiedClassName);
            return (CompiledWorkbook) type.getDeclaredConstructor().newInstance();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + qualifiedClassName, e);
        }
    }

    /** The runtime module and its dependencies, located from the classes this test can see. */
    private static String classpath() {
        return Stream.of(CellStore.class, LoggerFactory.class, ObjectMapper.class)
                .map(GeneratedProgramCompiler::location)
                .distinct()
                .collect(Collectors.joining(File.pathSeparator));
    }

    private static String location(Class<?> type) {
        try {
            return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Cannot locate " + type.getName(), e);
        }
    }
}
