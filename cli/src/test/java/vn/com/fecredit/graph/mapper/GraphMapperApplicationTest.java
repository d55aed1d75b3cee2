package vn.com.fecredit.graph.mapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import vn.com.fecredit.graph.mapper.cli.GraphMapperRunner;
import vn.com.fecredit.graph.mapper.config.GraphMapperProperties;
import vn.com.fecredit.graph.mapper.service.GraphMapperPipeline;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class GraphMapperApplicationTest {

    @Autowired
    GraphMapperRunner runner;

    @Autowired
    GraphMapperPipeline pipeline;

    @Autowired
    GraphMapperProperties properties;

    @Test
    void context_loads_with_configured_defaults() {
        assertThat(pipeline).isNotNull();
        assertThat(properties.getBatchSize()).isEqualTo(500);
        assertThat(properties.isIncludeIndexes()).isFalse();
    }

    @Test
    void runner_without_arguments_reports_usage_error() {
        // the runner already ran once at startup with no arguments
        assertThat(runner.getExitCode()).isEqualTo(1);
    }
}
