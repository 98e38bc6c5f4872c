package irforge.frontend;

import java.util.List;

public class FrontFnSig {
    public final boolean isUnsafe;
    public final List<FrontTy> inputs;
    public final FrontTy output;

    public FrontFnSig(boolean isUnsafe, List<FrontTy> inputs, FrontTy output) {
        this.isUnsafe = isUnsafe;
        this.inputs = List.copyOf(inputs);
        this.output = output;
    }
}
