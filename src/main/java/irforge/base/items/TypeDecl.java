package irforge.base.items;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericParams;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;

public class TypeDecl extends ItemDecl {
    public TypeDeclKind kind;

    public TypeDecl(AnyDeclId id, ItemMeta meta, GenericParams generics, TypeDeclKind kind) {
        super(id.expect(AnyDeclId.Kind.TYPE), meta, generics);
        this.kind = kind;
    }

    private List<Field> allFields() {
        List<Field> fields = new ArrayList<>();
        if (kind instanceof TypeDeclKind.Struct s) {
            fields.addAll(s.fields);
        } else if (kind instanceof TypeDeclKind.Union u) {
            fields.addAll(u.fields);
        } else if (kind instanceof TypeDeclKind.Enum e) {
            e.variants.forEach(v -> fields.addAll(v.fields));
        }
        return fields;
    }

    @Override
    public void foldTypes(TypeFolder folder) {
        super.foldTypes(folder);
        allFields().forEach(f -> f.ty = folder.foldTy(f.ty));
        if (kind instanceof TypeDeclKind.Alias alias) {
            alias.ty = folder.foldTy(alias.ty);
        }
    }

    @Override
    public void visitTypes(TypeVisitor visitor) {
        super.visitTypes(visitor);
        allFields().forEach(f -> visitor.visitTy(f.ty));
        if (kind instanceof TypeDeclKind.Alias alias) {
            visitor.visitTy(alias.ty);
        }
    }
}
