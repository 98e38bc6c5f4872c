package irforge.transform;

import irforge.base.items.TranslatedCrate;
import irforge.base.types.TyStore;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;

/**
 * What a pass may read or change: the crate, the options of the run and its diagnostics.
 */
public class TransformCtx {
    public final TranslatedCrate crate;
    public final TranslateOptions options;
    public final ErrorCtx errorCtx;

    public TransformCtx(TranslatedCrate crate, TranslateOptions options, ErrorCtx errorCtx) {
        this.crate = crate;
        this.options = options;
        this.errorCtx = errorCtx;
    }

    public TyStore store() {
        return crate.tyStore;
    }
}
