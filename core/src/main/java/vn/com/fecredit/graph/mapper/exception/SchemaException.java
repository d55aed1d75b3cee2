package vn.com.fecredit.graph.mapper.exception;

/**
 * Invalid identifier, unsupported type or oversized string length in schema DDL.
 */
public class SchemaException extends GraphMapperException {

    public SchemaException(String message) {
        super(ErrorKind.SCHEMA, message, null);
    }

    public SchemaException(String message, String context) {
        super(ErrorKind.SCHEMA, message, context);
    }
}
