package vn.com.fecredit.graph.mapper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for a run; command-line flags override them.
 */
@ConfigurationProperties(prefix = "graph-mapper")
public class GraphMapperProperties {

    private int batchSize = 500;
    private boolean includeIndexes = false;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isIncludeIndexes() {
        return includeIndexes;
    }

    public void setIncludeIndexes(boolean includeIndexes) {
        this.includeIndexes = includeIndexes;
    }
}
