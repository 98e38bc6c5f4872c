package irforge.base.expressions;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericArgs;
import irforge.base.types.TraitRef;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.Objects;

/**
 * A reference to a function with its generic arguments. When {@code traitRef} is set the call
 * goes through a trait: {@code funId} is then the method as declared in the trait and
 * {@code traitRef} tells which implementation provides it.
 */
public class FnPtr {
    public final AnyDeclId funId;
    public final TraitRef traitRef;
    public final String methodName;
    public final GenericArgs generics;

    public FnPtr(AnyDeclId funId, TraitRef traitRef, String methodName, GenericArgs generics) {
        this.funId = funId.expect(AnyDeclId.Kind.FUN);
        this.traitRef = traitRef;
        this.methodName = methodName;
        this.generics = Objects.requireNonNull(generics);
    }

    public static FnPtr regular(AnyDeclId funId, GenericArgs generics) {
        return new FnPtr(funId, null, null, generics);
    }

    public boolean isTraitMethod() {
        return traitRef != null;
    }

    public FnPtr foldTypes(TypeFolder folder) {
        return new FnPtr(funId, traitRef == null ? null : folder.foldTraitRef(traitRef), methodName,
                folder.foldGenericArgs(generics));
    }

    public void visitTypes(TypeVisitor visitor) {
        visitor.visitDeclId(funId);
        if (traitRef != null) {
            visitor.visitTraitRef(traitRef);
        }
        visitor.visitGenericArgs(generics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FnPtr fnPtr = (FnPtr) o;
        return funId.equals(fnPtr.funId) && Objects.equals(traitRef, fnPtr.traitRef)
                && Objects.equals(methodName, fnPtr.methodName) && generics.equals(fnPtr.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(funId, traitRef, methodName, generics);
    }

    @Override
    public String toString() {
        if (traitRef != null) {
            return traitRef.kind + "::" + methodName + generics;
        }
        return funId + generics.toString();
    }
}
