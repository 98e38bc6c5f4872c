package irforge.base.items;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericParams;
import irforge.base.types.Ty;
import irforge.base.types.TraitClause;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A trait declaration.
 * <pre>
 * trait Foo: Bar + Baz {       // parent clauses 0 and 1
 *     type Assoc: Clone;       // clause 0 of item "Assoc"
 *     const C: u32;
 *     fn f(&amp;self);
 * }
 * </pre>
 */
public class TraitDecl extends ItemDecl {
    public final List<TraitClause> parentClauses = new ArrayList<>();
    public final List<String> types = new ArrayList<>();
    public final Map<String, List<TraitClause>> typeClauses = new LinkedHashMap<>();
    public final Map<String, Ty> consts = new LinkedHashMap<>();
    /** Global computing the default value of an associated constant. */
    public final Map<String, AnyDeclId> constDefaults = new LinkedHashMap<>();
    public final Map<String, AnyDeclId> requiredMethods = new LinkedHashMap<>();
    public final Map<String, AnyDeclId> providedMethods = new LinkedHashMap<>();

    public TraitDecl(AnyDeclId id, ItemMeta meta, GenericParams generics) {
        super(id.expect(AnyDeclId.Kind.TRAIT_DECL), meta, generics);
    }

    /** Methods of the trait, required ones first. */
    public List<AnyDeclId> methods() {
        List<AnyDeclId> methods = new ArrayList<>(requiredMethods.values());
        methods.addAll(providedMethods.values());
        return methods;
    }

    @Override
    public void foldTypes(TypeFolder folder) {
        super.foldTypes(folder);
        parentClauses.replaceAll(c -> c.withTrait(folder.foldPolyTraitDeclRef(c.trait)));
        typeClauses.values().forEach(cs -> cs.replaceAll(c -> c.withTrait(folder.foldPolyTraitDeclRef(c.trait))));
        consts.replaceAll((name, ty) -> folder.foldTy(ty));
    }

    @Override
    public void visitTypes(TypeVisitor visitor) {
        super.visitTypes(visitor);
        parentClauses.forEach(c -> visitor.visitPolyTraitDeclRef(c.trait));
        typeClauses.values().forEach(cs -> cs.forEach(c -> visitor.visitPolyTraitDeclRef(c.trait)));
        consts.values().forEach(visitor::visitTy);
        constDefaults.values().forEach(visitor::visitDeclId);
        requiredMethods.values().forEach(visitor::visitDeclId);
        providedMethods.values().forEach(visitor::visitDeclId);
    }
}
