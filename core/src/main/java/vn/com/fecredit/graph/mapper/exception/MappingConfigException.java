package vn.com.fecredit.graph.mapper.exception;

/**
 * Malformed mapping definition: missing required fields, unknown types, invalid names.
 */
public class MappingConfigException extends GraphMapperException {

    public MappingConfigException(String message) {
        super(ErrorKind.MAPPING, message, null);
    }

    public MappingConfigException(String message, String context) {
        super(ErrorKind.MAPPING, message, context);
    }
}
