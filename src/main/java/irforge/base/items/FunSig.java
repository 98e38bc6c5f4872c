package irforge.base.items;

import irforge.base.types.Ty;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;

public class FunSig {
    public final boolean isUnsafe;
    public final List<Ty> inputs;
    public Ty output;

    public FunSig(boolean isUnsafe, List<Ty> inputs, Ty output) {
        this.isUnsafe = isUnsafe;
        this.inputs = new ArrayList<>(inputs);
        this.output = output;
    }

    void foldTypes(TypeFolder folder) {
        inputs.replaceAll(folder::foldTy);
        output = folder.foldTy(output);
    }

    void visitTypes(TypeVisitor visitor) {
        inputs.forEach(visitor::visitTy);
        visitor.visitTy(output);
    }

    @Override
    public String toString() {
        return inputs + " -> " + output;
    }
}
