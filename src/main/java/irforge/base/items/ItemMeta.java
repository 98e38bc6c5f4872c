package irforge.base.items;

import irforge.base.meta.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Source-level information attached to every item.
 */
public class ItemMeta {
    public final String name;
    public final Span span;
    public final boolean isPublic;
    public final boolean isLocal;
    public final List<String> attributes = new ArrayList<>();
    /** Name requested by a rename attribute, if any. */
    public String rename;
    /** The body (or definition) was not translated. */
    public boolean opaque;
    /** Set when translating the item failed and a placeholder was kept instead. */
    public String error;

    public ItemMeta(String name, Span span, boolean isPublic, boolean isLocal) {
        this.name = name;
        this.span = span == null ? Span.DUMMY : span;
        this.isPublic = isPublic;
        this.isLocal = isLocal;
    }

    public boolean hasError() {
        return error != null;
    }

    public String displayName() {
        return rename != null ? rename : name;
    }

    @Override
    public String toString() {
        return name;
    }
}
