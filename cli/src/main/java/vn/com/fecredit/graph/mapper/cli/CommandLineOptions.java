package vn.com.fecredit.graph.mapper.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code <mapping.yaml> <input.json> [--schema-only] [--batch-size N] [--with-indexes]}
 */
public final class CommandLineOptions {

    public static final String USAGE =
            "Usage: graph-mapper <mapping.yaml> <input.json> [--schema-only] [--batch-size N] [--with-indexes]";

    private final Path mappingFile;
    private final Path inputFile;
    private final boolean schemaOnly;
    private final Integer batchSize;
    private final boolean withIndexes;

    private CommandLineOptions(Path mappingFile, Path inputFile, boolean schemaOnly, Integer batchSize,
                               boolean withIndexes) {
        this.mappingFile = mappingFile;
        this.inputFile = inputFile;
        this.schemaOnly = schemaOnly;
        this.batchSize = batchSize;
        this.withIndexes = withIndexes;
    }

    /**
     * @throws IllegalArgumentException on missing files, unknown flags or a bad batch size
     */
    public static CommandLineOptions parse(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean schemaOnly = false;
        boolean withIndexes = false;
        Integer batchSize = null;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--schema-only")) {
                schemaOnly = true;
            } else if (a.equals("--with-indexes")) {
                withIndexes = true;
            } else if (a.equals("--batch-size") || a.startsWith("--batch-size=")) {
                String value;
                if (a.startsWith("--batch-size=")) {
                    value = a.substring("--batch-size=".length());
                } else if (i + 1 < args.length) {
                    value = args[++i];
                } else {
                    throw new IllegalArgumentException("Missing value for --batch-size");
                }
                batchSize = parseBatchSize(value);
            } else if (a.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + a);
            } else {
                positional.add(a);
            }
        }
        if (positional.size() != 2) {
            throw new IllegalArgumentException("Expected a mapping file and an input file");
        }
        return new CommandLineOptions(Path.of(positional.get(0)), Path.of(positional.get(1)),
                schemaOnly, batchSize, withIndexes);
    }

    private static int parseBatchSize(String value) {
        try {
            int n = Integer.parseInt(value.trim());
            if (n < 1) throw new IllegalArgumentException("Batch size must be at least 1: " + value);
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid batch size: " + value, e);
        }
    }

    public Path getMappingFile() { return mappingFile; }

    public Path getInputFile() { return inputFile; }

    public boolean isSchemaOnly() { return schemaOnly; }

    /** null when not given on the command line */
    public Integer getBatchSize() { return batchSize; }

    public boolean isWithIndexes() { return withIndexes; }
}
