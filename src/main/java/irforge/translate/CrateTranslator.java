package irforge.translate;

import irforge.base.items.ItemDecl;
import irforge.base.items.TranslatedCrate;
import irforge.frontend.DefId;
import irforge.utils.Logging;

/**
 * Translates every item of the crate, and every item they reference, into a
 * {@link TranslatedCrate}. Items are taken from a worklist seeded with the crate's own items.
 */
public class CrateTranslator {
    private final TranslateCtx t;

    public CrateTranslator(TranslateCtx t) {
        this.t = t;
    }

    public TranslatedCrate translate() {
        for (DefId def : t.oracle.localItems()) {
            t.registerId(null, def);
        }
        int count = 0;
        DefId def;
        while ((def = t.pollWork()) != null) {
            Logging.debug("CrateTranslator", "Translating " + def);
            for (ItemDecl item : new ItemTranslator(t, def).translate()) {
                t.crate.addItem(item);
                count++;
            }
        }
        Logging.info("CrateTranslator", String.format("Translated %d items of crate %s", count, t.crate.name));
        return t.crate;
    }
}
