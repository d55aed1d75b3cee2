package vn.com.fecredit.graph.mapper.statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects value tuples behind a fixed statement head and flushes them as one statement
 * every {@code batchSize} tuples.
 */
public class StatementBatch {

    private static final Logger log = LoggerFactory.getLogger(StatementBatch.class);

    private final String head;
    private final int batchSize;
    private final List<String> sink;
    private final List<String> tuples = new ArrayList<>();

    public StatementBatch(String head, int batchSize, List<String> sink) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
        }
        this.head = head;
        this.batchSize = batchSize;
        this.sink = sink;
    }

    public void add(String tuple) {
        tuples.add(tuple);
        if (tuples.size() >= batchSize) {
            flush();
        }
    }

    public void flush() {
        if (tuples.isEmpty()) return;
        sink.add(head + String.join(", ", tuples) + ";");
        log.debug("Flushed {} tuples for {}", tuples.size(), head);
        tuples.clear();
    }
}
