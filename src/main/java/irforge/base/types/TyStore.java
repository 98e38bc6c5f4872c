package irforge.base.types;

import irforge.utils.Logging;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hash-consing table for types, shared by every item of a translation run.
 * Interning is safe from any number of threads: for each structural shape exactly one
 * {@link Ty} is ever published.
 */
public class TyStore {
    private final ConcurrentHashMap<TyKind, Ty> table = new ConcurrentHashMap<>();

    public Ty intern(TyKind kind) {
        Ty existing = table.get(kind);
        if (existing != null) {
            return existing;
        }
        return table.computeIfAbsent(kind, k -> {
            Logging.trace("TyStore", String.format("New type %s", k));
            return new Ty(k);
        });
    }

    public int size() {
        return table.size();
    }

    public Ty unit() {
        return tuple(List.of());
    }

    public Ty never() {
        return intern(TyKind.Never.INSTANCE);
    }

    public Ty bool() {
        return literal(LiteralTy.BOOL);
    }

    public Ty integer(IntegerTy ty) {
        return literal(LiteralTy.integer(ty));
    }

    public Ty literal(LiteralTy ty) {
        return intern(new TyKind.Literal(ty));
    }

    public Ty typeVar(int index) {
        return intern(new TyKind.TypeVar(index));
    }

    public Ty tuple(List<Ty> fields) {
        var args = new GenericArgs(List.of(), fields, List.of(), List.of(), GenericsSource.BUILTIN);
        return intern(new TyKind.Adt(TypeId.TUPLE, args));
    }

    public Ty adt(AnyDeclId typeId, GenericArgs generics) {
        return intern(new TyKind.Adt(TypeId.adt(typeId), generics));
    }

    public Ty ref(Region region, Ty ty, RefKind kind) {
        return intern(new TyKind.Ref(region, ty, kind));
    }
}
