package vn.com.fecredit.graph.mapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import vn.com.fecredit.graph.mapper.config.GraphMapperProperties;

@SpringBootApplication(scanBasePackages = "vn.com.fecredit.graph.mapper")
@EnableConfigurationProperties(GraphMapperProperties.class)
public class GraphMapperApplication {
    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(GraphMapperApplication.class, args);
        System.exit(SpringApplication.exit(ctx));
    }
}
