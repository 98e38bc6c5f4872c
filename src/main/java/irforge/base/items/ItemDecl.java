package irforge.base.items;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericParams;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

/**
 * Common shape of every translated item.
 */
public abstract class ItemDecl {
    public final AnyDeclId id;
    public final ItemMeta meta;
    public final GenericParams generics;

    protected ItemDecl(AnyDeclId id, ItemMeta meta, GenericParams generics) {
        this.id = id;
        this.meta = meta;
        this.generics = generics;
    }

    /** Rewrite, in place, every type-level value held by this item. */
    public void foldTypes(TypeFolder folder) {
        generics.foldInPlace(folder);
    }

    public void visitTypes(TypeVisitor visitor) {
        generics.visit(visitor);
    }

    @Override
    public String toString() {
        return id + " " + meta.name + generics;
    }
}
