package irforge.translate;

import irforge.base.items.TranslatedCrate;
import irforge.base.meta.Span;
import irforge.base.types.AnyDeclId;
import irforge.base.types.TyStore;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;
import irforge.errors.TranslationError;
import irforge.frontend.DefId;
import irforge.frontend.FrontItem;
import irforge.frontend.FrontendOracle;
import irforge.utils.Logging;

import java.util.*;

/**
 * State shared by the translation of every item of a crate: the front end, the options, the
 * diagnostics, the crate being built, and the mapping from front-end ids to item ids.
 * <p>
 * Ids are allocated densely per kind the first time an item is referenced; every newly seen item
 * is queued for translation.
 */
public class TranslateCtx {
    public final FrontendOracle oracle;
    public final TranslateOptions options;
    public final ErrorCtx errorCtx;
    public final TranslatedCrate crate;

    private final Map<DefId, AnyDeclId> idMap = new HashMap<>();
    private final Map<AnyDeclId, DefId> reverseIdMap = new HashMap<>();
    private final EnumMap<AnyDeclId.Kind, Integer> nextIndex = new EnumMap<>(AnyDeclId.Kind.class);
    private final LinkedList<DefId> workList = new LinkedList<>();
    private final Map<DefId, Optional<FrontItem>> itemCache = new HashMap<>();

    public TranslateCtx(FrontendOracle oracle, TranslateOptions options, ErrorCtx errorCtx) {
        this.oracle = oracle;
        this.options = options;
        this.errorCtx = errorCtx;
        this.crate = new TranslatedCrate(oracle.crateName(), new TyStore());
    }

    public TyStore store() {
        return crate.tyStore;
    }

    public static AnyDeclId.Kind declKind(DefId.Kind kind) {
        if (kind.isType()) {
            return AnyDeclId.Kind.TYPE;
        } else if (kind.isGlobal()) {
            return AnyDeclId.Kind.GLOBAL;
        }
        return switch (kind) {
            case FN -> AnyDeclId.Kind.FUN;
            case TRAIT -> AnyDeclId.Kind.TRAIT_DECL;
            case IMPL -> AnyDeclId.Kind.TRAIT_IMPL;
            default -> throw new IllegalArgumentException("Unexpected definition kind " + kind);
        };
    }

    /**
     * The item id of {@code def}, allocating it (and queueing the item) on first use.
     */
    public synchronized AnyDeclId registerId(Span span, DefId def) {
        AnyDeclId id = idMap.get(def);
        if (id == null) {
            id = freshId(declKind(def.kind));
            idMap.put(def, id);
            reverseIdMap.put(id, def);
            workList.add(def);
            Logging.trace("TranslateCtx", String.format("Registered %s as %s (referenced at %s)", def, id, span));
        }
        return id;
    }

    /**
     * Register {@code def} and check that it has the expected kind of item id.
     */
    public AnyDeclId registerId(Span span, DefId def, AnyDeclId.Kind expected) {
        AnyDeclId id = registerId(span, def);
        if (id.kind != expected) {
            throw errorCtx.raise(span, TranslationError.Kind.RESOLUTION_FAILURE,
                    String.format("Expected %s to be a %s item, found %s", def, expected, id.kind));
        }
        return id;
    }

    /** An id with no front-end counterpart, e.g. the initializer of a global. */
    public synchronized AnyDeclId freshId(AnyDeclId.Kind kind) {
        int index = nextIndex.getOrDefault(kind, 0);
        nextIndex.put(kind, index + 1);
        return new AnyDeclId(kind, index);
    }

    public synchronized DefId defIdOf(AnyDeclId id) {
        return reverseIdMap.get(id);
    }

    public synchronized DefId pollWork() {
        return workList.poll();
    }

    public boolean isLocal(DefId def) {
        return def.krate.equals(crate.name);
    }

    public synchronized Optional<FrontItem> frontItem(DefId def) {
        return itemCache.computeIfAbsent(def, oracle::item);
    }
}
