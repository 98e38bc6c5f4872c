package irforge.driver;

import irforge.base.items.TranslatedCrate;
import irforge.errors.Diagnostic;

import java.util.List;

public class TranslationResult {
    public final TranslatedCrate crate;
    public final List<Diagnostic> diagnostics;

    public TranslationResult(TranslatedCrate crate, List<Diagnostic> diagnostics) {
        this.crate = crate;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
