package irforge.base.items;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericParams;
import irforge.base.types.Ty;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

/**
 * A constant or static. Its value is computed by the function {@code init}.
 */
public class GlobalDecl extends ItemDecl {
    public Ty ty;
    public final ItemKind kind;
    public final AnyDeclId init;

    public GlobalDecl(AnyDeclId id, ItemMeta meta, GenericParams generics, Ty ty, ItemKind kind, AnyDeclId init) {
        super(id.expect(AnyDeclId.Kind.GLOBAL), meta, generics);
        this.ty = ty;
        this.kind = kind;
        this.init = init.expect(AnyDeclId.Kind.FUN);
    }

    @Override
    public void foldTypes(TypeFolder folder) {
        super.foldTypes(folder);
        ty = folder.foldTy(ty);
    }

    @Override
    public void visitTypes(TypeVisitor visitor) {
        super.visitTypes(visitor);
        visitor.visitTy(ty);
        visitor.visitDeclId(init);
    }
}
