package vn.com.fecredit.graph.mapper.exception;

/**
 * Raised when a value cannot be pulled out of the input document or converted
 * to the type declared for its property.
 */
public class DataExtractionException extends GraphMapperException {

    public DataExtractionException(String message, String jsonPath) {
        super(ErrorKind.DATA, message, jsonPath);
    }

    public DataExtractionException(String message, String jsonPath, Throwable cause) {
        super(ErrorKind.DATA, message, jsonPath, cause);
    }

    public String getJsonPath() {
        return getContext();
    }
}
