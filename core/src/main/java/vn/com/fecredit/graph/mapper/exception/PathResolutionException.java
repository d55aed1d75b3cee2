package vn.com.fecredit.graph.mapper.exception;

/**
 * A path could not be followed through a document.
 */
public class PathResolutionException extends DataExtractionException {

    public enum Reason {
        NOT_FOUND,
        TYPE_MISMATCH
    }

    private final Reason reason;

    public PathResolutionException(Reason reason, String message, String path) {
        super(message, path);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isNotFound() {
        return reason == Reason.NOT_FOUND;
    }
}
