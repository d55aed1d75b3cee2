package vn.com.fecredit.graph.mapper.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import vn.com.fecredit.graph.mapper.config.GraphMapperProperties;
import vn.com.fecredit.graph.mapper.exception.GraphMapperException;
import vn.com.fecredit.graph.mapper.service.GenerationOptions;
import vn.com.fecredit.graph.mapper.service.GraphMapperPipeline;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry: reads the mapping and input files, prints one statement per line on
 * stdout. Any failure prints a single diagnostic line on stderr and sets exit code 1;
 * nothing is printed on stdout in that case.
 */
@Component
public class GraphMapperRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(GraphMapperRunner.class);

    private final GraphMapperPipeline pipeline;
    private final GraphMapperProperties properties;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode;

    @Autowired
    public GraphMapperRunner(GraphMapperPipeline pipeline, GraphMapperProperties properties) {
        this(pipeline, properties, System.out, System.err);
    }

    GraphMapperRunner(GraphMapperPipeline pipeline, GraphMapperProperties properties, PrintStream out,
                      PrintStream err) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Usage Error: " + e.getMessage() + ". " + CommandLineOptions.USAGE);
            return 1;
        }

        try {
            GenerationOptions generation = new GenerationOptions(options.isSchemaOnly(),
                    options.getBatchSize() != null ? options.getBatchSize() : properties.getBatchSize(),
                    options.isWithIndexes() || properties.isIncludeIndexes());
            String mapping = read(options.getMappingFile());
            String input = options.isSchemaOnly() ? null : read(options.getInputFile());
            List<String> statements = pipeline.generate(mapping, input, generation);
            statements.forEach(out::println);
            out.flush();
            return 0;
        } catch (IllegalArgumentException e) {
            log.debug("Invalid configuration", e);
            err.println("Config Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.debug("I/O failure", e);
            err.println("IO Error: " + e.getMessage());
            return 1;
        } catch (GraphMapperException e) {
            log.debug("Generation failed", e);
            err.println(e.describe());
            return 1;
        }
    }

    private static String read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Cannot read file: " + file);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
