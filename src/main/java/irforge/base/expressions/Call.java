package irforge.base.expressions;

import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

public class Call {
    public final FnOperand func;
    public final List<Operand> args;
    public final Place dest;

    public Call(FnOperand func, List<Operand> args, Place dest) {
        this.func = Objects.requireNonNull(func);
        this.args = List.copyOf(args);
        this.dest = Objects.requireNonNull(dest);
    }

    public Call mapLocals(IntUnaryOperator f) {
        List<Operand> mapped = new ArrayList<>();
        args.forEach(a -> mapped.add(a.mapLocals(f)));
        return new Call(func.mapLocals(f), mapped, dest.mapLocals(f));
    }

    public void forEachLocal(IntConsumer f) {
        func.forEachLocal(f);
        args.forEach(a -> a.forEachLocal(f));
        f.accept(dest.local);
    }

    public Call foldTypes(TypeFolder folder) {
        List<Operand> folded = new ArrayList<>();
        args.forEach(a -> folded.add(a.foldTypes(folder)));
        return new Call(func.foldTypes(folder), folded, dest);
    }

    public void visitTypes(TypeVisitor visitor) {
        func.visitTypes(visitor);
        args.forEach(a -> a.visitTypes(visitor));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Call call = (Call) o;
        return func.equals(call.func) && args.equals(call.args) && dest.equals(call.dest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(func, args, dest);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", dest + " = " + func + "(", ")");
        args.forEach(a -> joiner.add(a.toString()));
        return joiner.toString();
    }
}
