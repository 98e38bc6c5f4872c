package irforge.base.types;

import java.util.List;
import java.util.Objects;

/**
 * Inputs and output of a function-pointer type.
 */
public class ArrowSig {
    public final List<Ty> inputs;
    public final Ty output;

    public ArrowSig(List<Ty> inputs, Ty output) {
        this.inputs = List.copyOf(inputs);
        this.output = Objects.requireNonNull(output);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArrowSig arrowSig = (ArrowSig) o;
        return inputs.equals(arrowSig.inputs) && output.equals(arrowSig.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputs, output);
    }

    @Override
    public String toString() {
        return "fn" + inputs + " -> " + output;
    }
}
