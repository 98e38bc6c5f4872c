package irforge.base.expressions;

import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericArgs;
import irforge.base.types.Literal;
import irforge.base.types.Ty;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.Objects;

/**
 * A constant operand, always annotated with its type.
 */
public abstract class ConstantExpr {
    public final Ty ty;

    protected ConstantExpr(Ty ty) {
        this.ty = Objects.requireNonNull(ty);
    }

    public abstract ConstantExpr foldTypes(TypeFolder folder);

    public void visitTypes(TypeVisitor visitor) {
        visitor.visitTy(ty);
    }

    public static final class Lit extends ConstantExpr {
        public final Literal value;

        public Lit(Literal value, Ty ty) {
            super(ty);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public ConstantExpr foldTypes(TypeFolder folder) {
            return new Lit(value, folder.foldTy(ty));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lit other && value.equals(other.value) && ty.equals(other.ty);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, ty);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /** The value of a global constant. */
    public static final class Global extends ConstantExpr {
        public final AnyDeclId globalId;
        public final GenericArgs generics;

        public Global(AnyDeclId globalId, GenericArgs generics, Ty ty) {
            super(ty);
            this.globalId = globalId.expect(AnyDeclId.Kind.GLOBAL);
            this.generics = Objects.requireNonNull(generics);
        }

        @Override
        public ConstantExpr foldTypes(TypeFolder folder) {
            return new Global(globalId, folder.foldGenericArgs(generics), folder.foldTy(ty));
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            super.visitTypes(visitor);
            visitor.visitDeclId(globalId);
            visitor.visitGenericArgs(generics);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Global other && globalId.equals(other.globalId)
                    && generics.equals(other.generics) && ty.equals(other.ty);
        }

        @Override
        public int hashCode() {
            return Objects.hash(globalId, generics, ty);
        }

        @Override
        public String toString() {
            return globalId + generics.toString();
        }
    }

    /** A function used as a value. */
    public static final class Fn extends ConstantExpr {
        public final FnPtr fnPtr;

        public Fn(FnPtr fnPtr, Ty ty) {
            super(ty);
            this.fnPtr = Objects.requireNonNull(fnPtr);
        }

        @Override
        public ConstantExpr foldTypes(TypeFolder folder) {
            return new Fn(fnPtr.foldTypes(folder), folder.foldTy(ty));
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            super.visitTypes(visitor);
            fnPtr.visitTypes(visitor);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Fn other && fnPtr.equals(other.fnPtr) && ty.equals(other.ty);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fnPtr, ty);
        }

        @Override
        public String toString() {
            return fnPtr.toString();
        }
    }
}
