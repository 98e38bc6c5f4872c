package irforge.base.items;

import irforge.base.types.AnyDeclId;

import java.util.List;

/**
 * A set of items that must be declared together: a single non-recursive item, or a group of
 * mutually recursive ones.
 */
public class DeclarationGroup {
    public final boolean recursive;
    public final List<AnyDeclId> items;

    private DeclarationGroup(boolean recursive, List<AnyDeclId> items) {
        this.recursive = recursive;
        this.items = List.copyOf(items);
    }

    public static DeclarationGroup nonRec(AnyDeclId id) {
        return new DeclarationGroup(false, List.of(id));
    }

    public static DeclarationGroup rec(List<AnyDeclId> ids) {
        return new DeclarationGroup(true, ids);
    }

    @Override
    public String toString() {
        return (recursive ? "Rec" : "NonRec") + items;
    }
}
