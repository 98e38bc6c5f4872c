package irforge.base.items;

import irforge.base.types.AnyDeclId;

/**
 * Whether a function or global is a free item or belongs to a trait declaration or
 * implementation.
 */
public class ItemKind {
    public enum Kind {
        REGULAR,
        TRAIT_DECL,
        TRAIT_IMPL
    }

    public static final ItemKind REGULAR = new ItemKind(Kind.REGULAR, null, null, null, false);

    public final Kind kind;
    public final AnyDeclId traitId;
    /** Set for {@link Kind#TRAIT_IMPL}. */
    public final AnyDeclId implId;
    public final String itemName;
    /** For trait declarations: the item has a default definition. */
    public final boolean hasDefault;

    private ItemKind(Kind kind, AnyDeclId traitId, AnyDeclId implId, String itemName, boolean hasDefault) {
        this.kind = kind;
        this.traitId = traitId;
        this.implId = implId;
        this.itemName = itemName;
        this.hasDefault = hasDefault;
    }

    public static ItemKind traitDecl(AnyDeclId traitId, String itemName, boolean hasDefault) {
        return new ItemKind(Kind.TRAIT_DECL, traitId.expect(AnyDeclId.Kind.TRAIT_DECL), null, itemName, hasDefault);
    }

    public static ItemKind traitImpl(AnyDeclId implId, AnyDeclId traitId, String itemName) {
        return new ItemKind(Kind.TRAIT_IMPL, traitId.expect(AnyDeclId.Kind.TRAIT_DECL),
                implId.expect(AnyDeclId.Kind.TRAIT_IMPL), itemName, false);
    }

    public boolean isTraitDecl() {
        return kind == Kind.TRAIT_DECL;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case REGULAR -> "regular";
            case TRAIT_DECL -> "trait_decl(" + traitId + "::" + itemName + ")";
            case TRAIT_IMPL -> "trait_impl(" + implId + "::" + itemName + ")";
        };
    }
}
