package irforge.base.items;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericParams;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

/**
 * A function, method or global initializer. It holds an unstructured body until structuring
 * replaces it with a structured one; opaque functions hold neither.
 */
public class FunDecl extends ItemDecl {
    public final FunSig signature;
    public final ItemKind kind;
    /** Set when this function computes the value of the given global. */
    public final AnyDeclId globalInitializerOf;
    public irforge.base.ullbc.Body unstructuredBody;
    public irforge.base.llbc.Body structuredBody;

    public FunDecl(AnyDeclId id, ItemMeta meta, GenericParams generics, FunSig signature, ItemKind kind,
                   AnyDeclId globalInitializerOf) {
        super(id.expect(AnyDeclId.Kind.FUN), meta, generics);
        this.signature = signature;
        this.kind = kind;
        this.globalInitializerOf = globalInitializerOf;
    }

    public boolean hasBody() {
        return unstructuredBody != null || structuredBody != null;
    }

    /** Drop the body and mark the function opaque. */
    public void makeOpaque() {
        unstructuredBody = null;
        structuredBody = null;
        meta.opaque = true;
    }

    @Override
    public void foldTypes(TypeFolder folder) {
        super.foldTypes(folder);
        signature.foldTypes(folder);
        if (unstructuredBody != null) {
            unstructuredBody.foldTypes(folder);
        }
        if (structuredBody != null) {
            structuredBody.foldTypes(folder);
        }
    }

    @Override
    public void visitTypes(TypeVisitor visitor) {
        super.visitTypes(visitor);
        signature.visitTypes(visitor);
        visitBody(visitor);
    }

    /** Visit the body only, if there is one. */
    public void visitBody(TypeVisitor visitor) {
        if (unstructuredBody != null) {
            unstructuredBody.visitTypes(visitor);
        }
        if (structuredBody != null) {
            structuredBody.visitTypes(visitor);
        }
    }
}
