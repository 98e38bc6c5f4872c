package irforge.errors;

import irforge.base.meta.Span;
import irforge.utils.Logging;

import java.util.*;

/**
 * Collects diagnostics for a translation run and decides whether a failure may be
 * downgraded to a diagnostic plus a placeholder value.
 * Shared by every item, so all methods are thread-safe.
 */
public class ErrorCtx {
    private final boolean continueOnFailure;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<Span> reportedSpans = new HashSet<>();

    public ErrorCtx(boolean continueOnFailure) {
        this.continueOnFailure = continueOnFailure;
    }

    public boolean continueOnFailure() {
        return continueOnFailure;
    }

    /**
     * Record a diagnostic. Only the first diagnostic of a given span is kept.
     */
    public synchronized void spanErr(Span span, TranslationError.Kind kind, String msg) {
        if (span != null && span != Span.DUMMY && !reportedSpans.add(span)) {
            Logging.debug("ErrorCtx", String.format("Duplicate error at %s: %s", span, msg));
            return;
        }
        diagnostics.add(new Diagnostic(span, kind, msg));
        Logging.error("ErrorCtx", span == null ? msg : String.format("%s: %s", span, msg));
    }

    /**
     * Record a diagnostic and build the error to throw. The error travels up to the closest
     * recovery boundary, which consults {@link #canRecover(TranslationError)}.
     */
    public TranslationError raise(Span span, TranslationError.Kind kind, String msg) {
        spanErr(span, kind, msg);
        return new TranslationError(kind, span, msg);
    }

    /**
     * Whether a recovery boundary may swallow the given error and substitute a placeholder.
     */
    public boolean canRecover(TranslationError err) {
        return continueOnFailure && err.kind.isRecoverable();
    }

    public synchronized List<Diagnostic> getDiagnostics() {
        return new ArrayList<>(diagnostics);
    }

    public synchronized int errorCount() {
        return diagnostics.size();
    }
}
