package vn.com.fecredit.graph.mapper.exception;

/**
 * Base type for every failure raised while loading a mapping or generating statements.
 *
 * <p>The first failure aborts the whole generation run; callers never receive a partial
 * statement list.</p>
 */
public class GraphMapperException extends RuntimeException {

    private final ErrorKind kind;
    private final String context;

    public GraphMapperException(ErrorKind kind, String message, String context) {
        super(message);
        this.kind = kind;
        this.context = context;
    }

    public GraphMapperException(ErrorKind kind, String message, String context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.context = context;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Element name, property or json path the failure relates to; may be null. */
    public String getContext() {
        return context;
    }

    /**
     * One-line diagnostic, e.g. {@code Schema Error: Unsupported type: money (Place.price)}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.getLabel()).append(": ").append(getMessage());
        if (context != null && !context.isBlank()) {
            sb.append(" (").append(context).append(")");
        }
        return sb.toString();
    }
}
