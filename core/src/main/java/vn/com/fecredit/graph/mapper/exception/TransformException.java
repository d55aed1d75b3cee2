package vn.com.fecredit.graph.mapper.exception;

/**
 * Unknown transform name or a transform that rejected its input.
 */
public class TransformException extends GraphMapperException {

    private final String sourceValue;

    public TransformException(String message) {
        this(message, null, null);
    }

    public TransformException(String message, String sourceValue) {
        this(message, sourceValue, null);
    }

    public TransformException(String message, String sourceValue, Throwable cause) {
        super(ErrorKind.TRANSFORM, message, sourceValue, cause);
        this.sourceValue = sourceValue;
    }

    /** The raw input the transform failed on, if known. */
    public String getSourceValue() {
        return sourceValue;
    }
}
