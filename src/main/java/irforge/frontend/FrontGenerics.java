package irforge.frontend;

import irforge.base.types.LiteralTy;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic parameters and where-clauses of an item, as the front end reports them.
 */
public class FrontGenerics {
    public static class ConstParam {
        public final String name;
        public final LiteralTy ty;

        public ConstParam(String name, LiteralTy ty) {
            this.name = name;
            this.ty = ty;
        }
    }

    public final List<String> regions = new ArrayList<>();
    public final List<String> types = new ArrayList<>();
    public final List<ConstParam> consts = new ArrayList<>();
    public final List<FrontClause> predicates = new ArrayList<>();

    public static FrontGenerics empty() {
        return new FrontGenerics();
    }
}
