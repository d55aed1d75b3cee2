package vn.com.fecredit.graph.mapper.transform;

import java.util.Map;

@FunctionalInterface
public interface TransformFunction {

    TransformValue apply(TransformValue input, Map<String, String> params);
}
