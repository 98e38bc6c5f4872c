package irforge.frontend;

import java.util.Objects;

/**
 * Stable front-end identifier of a definition.
 */
public class DefId {
    public enum Kind {
        STRUCT,
        ENUM,
        UNION,
        TYPE_ALIAS,
        FOREIGN_TYPE,
        FN,
        CONST,
        STATIC,
        TRAIT,
        IMPL;

        public boolean isType() {
            return this == STRUCT || this == ENUM || this == UNION || this == TYPE_ALIAS || this == FOREIGN_TYPE;
        }

        public boolean isGlobal() {
            return this == CONST || this == STATIC;
        }
    }

    public final String krate;
    /** Path inside the crate, e.g. {@code module::Trait::method}. */
    public final String path;
    public final Kind kind;

    public DefId(String krate, String path, Kind kind) {
        this.krate = Objects.requireNonNull(krate);
        this.path = Objects.requireNonNull(path);
        this.kind = Objects.requireNonNull(kind);
    }

    public String name() {
        return krate + "::" + path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefId defId = (DefId) o;
        return krate.equals(defId.krate) && path.equals(defId.path) && kind == defId.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(krate, path, kind);
    }

    @Override
    public String toString() {
        return name();
    }
}
