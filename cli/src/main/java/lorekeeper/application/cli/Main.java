package lorekeeper.application.cli;

import io.vavr.control.Try;
import jakarta.inject.Inject;
import lorekeeper.Marker;
import lorekeeper.domain.json.JsonDeserializer;
import lorekeeper.domain.logging.LogConfig;
import lorekeeper.domain.model.SemanticRecord;
import lorekeeper.domain.pipeline.ExtractionPipeline;
import lorekeeper.domain.store.SemanticStore;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;

/**
 * Usage:
 * <pre>
 * lorekeeper extract items.json
 * lorekeeper query
 * </pre>
 * Query filters are read from the lk.query.* settings, e.g. -Dlk.query.kind=glossary -Dlk.query.keywords=deploy,cab
 */
public class Main {
    private static final String EXTRACT = "extract";
    private static final String QUERY = "query";

    @Inject
    private ExtractionPipeline extractionPipeline;

    @Inject
    private SemanticStore semanticStore;

    @Inject
    private RawItemReader rawItemReader;

    @Inject
    private QueryConfig queryConfig;

    @Inject
    private ConsoleProgress consoleProgress;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    @ConfigProperty(name = "lk.output.file")
    private Optional<String> file;

    public static void main(final String[] args) {
        LogConfig.init();

        final Weld weld = new Weld();
        // Scanning from the marker finds the beans in every module of an uber jar
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            weldContainer.select(Main.class).get().entry(args);
        }
    }

    public void entry(final String[] args) {
        final String command = args.length > 0 ? args[0] : "";

        Try.of(() -> runCommand(command, args))
                .map(jsonDeserializer::serialize)
                .onSuccess(this::printOutput)
                .onSuccess(this::writeOutput)
                .onFailure(e -> System.err.println("Failed to run " + StringUtils.defaultIfBlank(command, "command") + ": " + e.getMessage()));
    }

    private List<SemanticRecord> runCommand(final String command, final String[] args) throws Exception {
        if (EXTRACT.equalsIgnoreCase(command)) {
            return extractionPipeline.run(rawItemReader.read(Paths.get(getInputFile(args))), consoleProgress);
        }

        if (QUERY.equalsIgnoreCase(command)) {
            return semanticStore.retrieve(queryConfig.getQuery());
        }

        throw new IllegalArgumentException("Expected a command of " + EXTRACT + " or " + QUERY);
    }

    private String getInputFile(final String[] args) {
        if (args.length > 1 && StringUtils.isNotBlank(args[1])) {
            return args[1];
        }

        throw new IllegalArgumentException("No input file specified");
    }

    private void printOutput(final String content) {
        if (file.isEmpty()) {
            System.out.println(content);
        }
    }

    private void writeOutput(final String content) {
        if (file.isEmpty()) {
            return;
        }

        Try.run(() -> Files.write(Paths.get(file.get()), content.getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))
                .onSuccess(v -> System.err.println("Wrote output to " + file.get()))
                .onFailure(e -> System.err.println("Failed to write output to file: " + e.getMessage()));
    }
}
