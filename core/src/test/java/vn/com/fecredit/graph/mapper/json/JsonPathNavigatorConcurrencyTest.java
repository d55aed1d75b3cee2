package vn.com.fecredit.graph.mapper.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JsonPathNavigatorConcurrencyTest {

    @Test
    void concurrent_lookups_share_one_cache_entry_per_path() throws Exception {
        ObjectMapper om = new ObjectMapper();
        ObjectNode root = om.createObjectNode();
        ArrayNode items = root.putArray("items");
        for (int i = 0; i < 50; i++) {
            items.addObject().put("value", i);
        }
        JsonPathNavigator navigator = new JsonPathNavigator(om);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                tasks.add(() -> {
                    for (int round = 0; round < 20; round++) {
                        for (int i = 0; i < 50; i++) {
                            JsonNode v = navigator.resolve(root, "/items[" + i + "]/value");
                            if (v.asInt() != i) return false;
                        }
                    }
                    return true;
                });
            }
            for (Future<Boolean> f : pool.invokeAll(tasks)) {
                assertThat(f.get()).isTrue();
            }
        } finally {
            pool.shutdown();
            pool.awaitTermination(10, TimeUnit.SECONDS);
        }
        assertThat(navigator.cacheSize()).isEqualTo(50);
    }
}
