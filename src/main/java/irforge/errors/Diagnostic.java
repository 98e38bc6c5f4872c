package irforge.errors;

import irforge.base.meta.Span;

/**
 * A recorded, recoverable error attached to a source span.
 */
public class Diagnostic {
    public final Span span;
    public final TranslationError.Kind kind;
    public final String message;

    public Diagnostic(Span span, TranslationError.Kind kind, String message) {
        this.span = span;
        this.kind = kind;
        this.message = message;
    }

    public String getSpan() {
        return span == null ? null : span.toString();
    }

    public TranslationError.Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", kind, span, message);
    }
}
