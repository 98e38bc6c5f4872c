package irforge.base.items;

import irforge.base.types.AnyDeclId;
import irforge.base.types.TyStore;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Every item of a translated crate, keyed by dense per-kind ids.
 * Per-item work takes the read lock; whole-crate rewrites take the write lock.
 */
public class TranslatedCrate {
    public final String name;
    public final TyStore tyStore;
    public final TreeMap<AnyDeclId, TypeDecl> typeDecls = new TreeMap<>();
    public final TreeMap<AnyDeclId, FunDecl> funDecls = new TreeMap<>();
    public final TreeMap<AnyDeclId, GlobalDecl> globalDecls = new TreeMap<>();
    public final TreeMap<AnyDeclId, TraitDecl> traitDecls = new TreeMap<>();
    public final TreeMap<AnyDeclId, TraitImpl> traitImpls = new TreeMap<>();
    public final List<DeclarationGroup> orderedDecls = new ArrayList<>();
    public final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public TranslatedCrate(String name, TyStore tyStore) {
        this.name = name;
        this.tyStore = tyStore;
    }

    public ItemDecl item(AnyDeclId id) {
        return switch (id.kind) {
            case TYPE -> typeDecls.get(id);
            case FUN -> funDecls.get(id);
            case GLOBAL -> globalDecls.get(id);
            case TRAIT_DECL -> traitDecls.get(id);
            case TRAIT_IMPL -> traitImpls.get(id);
        };
    }

    public void addItem(ItemDecl item) {
        if (item instanceof TypeDecl decl) {
            typeDecls.put(decl.id, decl);
        } else if (item instanceof FunDecl decl) {
            funDecls.put(decl.id, decl);
        } else if (item instanceof GlobalDecl decl) {
            globalDecls.put(decl.id, decl);
        } else if (item instanceof TraitDecl decl) {
            traitDecls.put(decl.id, decl);
        } else if (item instanceof TraitImpl decl) {
            traitImpls.put(decl.id, decl);
        } else {
            throw new IllegalArgumentException("Unknown item kind " + item.getClass().getSimpleName());
        }
    }

    /** Every item, in id order within each kind. */
    public List<ItemDecl> allItems() {
        List<ItemDecl> items = new ArrayList<>();
        items.addAll(typeDecls.values());
        items.addAll(funDecls.values());
        items.addAll(globalDecls.values());
        items.addAll(traitDecls.values());
        items.addAll(traitImpls.values());
        return items;
    }

    public int itemCount() {
        return typeDecls.size() + funDecls.size() + globalDecls.size() + traitDecls.size() + traitImpls.size();
    }
}
