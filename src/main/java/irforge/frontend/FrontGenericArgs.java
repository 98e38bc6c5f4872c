package irforge.frontend;

import java.util.List;

/**
 * Generic arguments of a reference, split by kind, with the witnesses of the referenced item's
 * trait clauses in {@code implExprs}.
 */
public class FrontGenericArgs {
    public static final FrontGenericArgs EMPTY = new FrontGenericArgs(List.of(), List.of(), List.of(), List.of());

    public final List<FrontRegion> regions;
    public final List<FrontTy> types;
    public final List<FrontConst> consts;
    public final List<ImplExpr> implExprs;

    public FrontGenericArgs(List<FrontRegion> regions, List<FrontTy> types, List<FrontConst> consts,
                            List<ImplExpr> implExprs) {
        this.regions = List.copyOf(regions);
        this.types = List.copyOf(types);
        this.consts = List.copyOf(consts);
        this.implExprs = List.copyOf(implExprs);
    }

    public static FrontGenericArgs types(FrontTy... types) {
        return new FrontGenericArgs(List.of(), List.of(types), List.of(), List.of());
    }

    public boolean isEmpty() {
        return regions.isEmpty() && types.isEmpty() && consts.isEmpty() && implExprs.isEmpty();
    }
}
