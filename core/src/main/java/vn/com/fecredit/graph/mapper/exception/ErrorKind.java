package vn.com.fecredit.graph.mapper.exception;

/**
 * Category of a generation failure. The label is what the command line prints
 * in front of the diagnostic message.
 */
public enum ErrorKind {
    JSON("JSON Error"),
    YAML("YAML Error"),
    MAPPING("Mapping Error"),
    DATA("Data Error"),
    TRANSFORM("Transform Error"),
    SCHEMA("Schema Error");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
