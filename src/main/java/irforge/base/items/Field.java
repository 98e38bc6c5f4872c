package irforge.base.items;

import irforge.base.meta.Span;
import irforge.base.types.Ty;

public class Field {
    public final Span span;
    /** Null for tuple-like fields. */
    public final String name;
    public Ty ty;

    public Field(Span span, String name, Ty ty) {
        this.span = span;
        this.name = name;
        this.ty = ty;
    }

    @Override
    public String toString() {
        return (name == null ? "" : name + ": ") + ty;
    }
}
