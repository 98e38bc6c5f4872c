package irforge.base.items;

import irforge.base.types.Ty;

import java.util.List;

public abstract class TypeDeclKind {

    public static final class Struct extends TypeDeclKind {
        public final List<Field> fields;

        public Struct(List<Field> fields) {
            this.fields = List.copyOf(fields);
        }
    }

    public static final class Enum extends TypeDeclKind {
        public final List<Variant> variants;

        public Enum(List<Variant> variants) {
            this.variants = List.copyOf(variants);
        }
    }

    public static final class Union extends TypeDeclKind {
        public final List<Field> fields;

        public Union(List<Field> fields) {
            this.fields = List.copyOf(fields);
        }
    }

    /** A type whose definition is not available or not translated. */
    public static final class Opaque extends TypeDeclKind {
        public static final Opaque INSTANCE = new Opaque();

        private Opaque() {}
    }

    public static final class Alias extends TypeDeclKind {
        public Ty ty;

        public Alias(Ty ty) {
            this.ty = ty;
        }
    }

    /** Placeholder for a type whose translation failed. */
    public static final class Error extends TypeDeclKind {
        public final String message;

        public Error(String message) {
            this.message = message;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
