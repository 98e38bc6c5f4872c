package irforge.base.expressions;

import irforge.base.types.Ty;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;

public class Locals {
    public final int argCount;
    public final List<Local> vars = new ArrayList<>();

    public Locals(int argCount) {
        this.argCount = argCount;
    }

    public Local newVar(String name, Ty ty) {
        Local local = new Local(vars.size(), name, ty);
        vars.add(local);
        return local;
    }

    public Place returnPlace() {
        return Place.local(0);
    }

    public int size() {
        return vars.size();
    }

    /** The return place and the arguments are part of the signature and are never removed. */
    public boolean isSignatureLocal(int index) {
        return index <= argCount;
    }

    public void foldTypes(TypeFolder folder) {
        vars.replaceAll(local -> local.withTy(folder.foldTy(local.ty)));
    }

    public void visitTypes(TypeVisitor visitor) {
        vars.forEach(local -> visitor.visitTy(local.ty));
    }
}
