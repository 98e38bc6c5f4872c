package irforge.base.items;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericParams;
import irforge.base.types.TraitDeclRef;
import irforge.base.types.TraitRef;
import irforge.base.types.Ty;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A trait implementation, with the witnesses for the parent clauses and the associated type
 * clauses of the implemented trait.
 */
public class TraitImpl extends ItemDecl {
    /** Null for opaque placeholders. */
    public TraitDeclRef implTrait;
    public final List<TraitRef> parentTraitRefs = new ArrayList<>();
    public final Map<String, Ty> types = new LinkedHashMap<>();
    public final Map<String, List<TraitRef>> typeClauses = new LinkedHashMap<>();
    public final Map<String, AnyDeclId> consts = new LinkedHashMap<>();
    public final Map<String, AnyDeclId> requiredMethods = new LinkedHashMap<>();
    public final Map<String, AnyDeclId> providedMethods = new LinkedHashMap<>();

    public TraitImpl(AnyDeclId id, ItemMeta meta, GenericParams generics, TraitDeclRef implTrait) {
        super(id.expect(AnyDeclId.Kind.TRAIT_IMPL), meta, generics);
        this.implTrait = implTrait;
    }

    @Override
    public void foldTypes(TypeFolder folder) {
        super.foldTypes(folder);
        if (implTrait != null) {
            implTrait = folder.foldTraitDeclRef(implTrait);
        }
        parentTraitRefs.replaceAll(folder::foldTraitRef);
        types.replaceAll((name, ty) -> folder.foldTy(ty));
        typeClauses.values().forEach(refs -> refs.replaceAll(folder::foldTraitRef));
    }

    @Override
    public void visitTypes(TypeVisitor visitor) {
        super.visitTypes(visitor);
        if (implTrait != null) {
            visitor.visitTraitDeclRef(implTrait);
        }
        parentTraitRefs.forEach(visitor::visitTraitRef);
        types.values().forEach(visitor::visitTy);
        typeClauses.values().forEach(refs -> refs.forEach(visitor::visitTraitRef));
        consts.values().forEach(visitor::visitDeclId);
        requiredMethods.values().forEach(visitor::visitDeclId);
        providedMethods.values().forEach(visitor::visitDeclId);
    }
}
