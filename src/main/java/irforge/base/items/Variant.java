package irforge.base.items;

import irforge.base.meta.Span;
import irforge.base.types.ScalarValue;

import java.util.List;

public class Variant {
    public final Span span;
    public final String name;
    public final List<Field> fields;
    public final ScalarValue discriminant;

    public Variant(Span span, String name, List<Field> fields, ScalarValue discriminant) {
        this.span = span;
        this.name = name;
        this.fields = List.copyOf(fields);
        this.discriminant = discriminant;
    }

    @Override
    public String toString() {
        return name + fields + " = " + discriminant;
    }
}
