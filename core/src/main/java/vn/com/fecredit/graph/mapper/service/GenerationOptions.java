package vn.com.fecredit.graph.mapper.service;

public final class GenerationOptions {
    private final boolean schemaOnly;
    private final int batchSize;
    private final boolean includeIndexes;

    public GenerationOptions(boolean schemaOnly, int batchSize, boolean includeIndexes) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
        }
        this.schemaOnly = schemaOnly;
        this.batchSize = batchSize;
        this.includeIndexes = includeIndexes;
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(false, StatementGenerator.DEFAULT_BATCH_SIZE, false);
    }

    public boolean isSchemaOnly() { return schemaOnly; }

    public int getBatchSize() { return batchSize; }

    public boolean isIncludeIndexes() { return includeIndexes; }
}
