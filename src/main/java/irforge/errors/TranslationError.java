package irforge.errors;

import irforge.base.meta.Span;

/**
 * Raised when a construct cannot be represented, when the front-end failed to resolve
 * an obligation, or when a body violates the block-graph invariants.
 */
public class TranslationError extends RuntimeException {

    public enum Kind {
        /** An obligation kind or resolution-path shape the model cannot represent. */
        UNSUPPORTED_CONSTRUCT,
        /** The front-end could not produce a witness. */
        RESOLUTION_FAILURE,
        /** A body violates a structural invariant. Never recoverable. */
        MALFORMED_GRAPH;

        public boolean isRecoverable() {
            return this != MALFORMED_GRAPH;
        }
    }

    public final Kind kind;
    public final Span span;

    public TranslationError(Kind kind, Span span, String message) {
        super(message);
        this.kind = kind;
        this.span = span;
    }

    public static TranslationError malformedGraph(String message) {
        return new TranslationError(Kind.MALFORMED_GRAPH, null, message);
    }

    @Override
    public String toString() {
        if (span == null) {
            return String.format("%s: %s", kind, getMessage());
        }
        return String.format("%s at %s: %s", kind, span, getMessage());
    }
}
