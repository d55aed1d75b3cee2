package vn.com.fecredit.graph.mapper.exception;

/**
 * The mapping YAML or the input JSON is not syntactically valid.
 * Line and column are 1-based and null when the parser could not tell.
 */
public class DocumentParseException extends GraphMapperException {

    private final Integer line;
    private final Integer column;

    public DocumentParseException(ErrorKind kind, String message, Integer line, Integer column, Throwable cause) {
        super(kind, message, null, cause);
        this.line = line;
        this.column = column;
    }

    public Integer getLine() {
        return line;
    }

    public Integer getColumn() {
        return column;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(getKind().getLabel()).append(": ").append(getMessage());
        if (line != null) {
            sb.append(" at line ").append(line);
            if (column != null) sb.append(", column ").append(column);
        }
        return sb.toString();
    }
}
