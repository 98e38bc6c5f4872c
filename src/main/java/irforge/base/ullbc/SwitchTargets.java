package irforge.base.ullbc;

import irforge.base.types.IntegerTy;
import irforge.base.types.ScalarValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * The targets of a switch terminator, in declaration order.
 */
public abstract class SwitchTargets {

    public abstract List<Integer> targets();

    public abstract SwitchTargets retarget(IntUnaryOperator f);

    /** Two-way branch on a boolean. */
    public static final class If extends SwitchTargets {
        public final int thenBlock;
        public final int elseBlock;

        public If(int thenBlock, int elseBlock) {
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        @Override
        public List<Integer> targets() {
            return List.of(thenBlock, elseBlock);
        }

        @Override
        public SwitchTargets retarget(IntUnaryOperator f) {
            return new If(f.applyAsInt(thenBlock), f.applyAsInt(elseBlock));
        }

        @Override
        public String toString() {
            return String.format("true -> bb%d, false -> bb%d", thenBlock, elseBlock);
        }
    }

    public static final class Branch {
        public final ScalarValue value;
        public final int target;

        public Branch(ScalarValue value, int target) {
            this.value = Objects.requireNonNull(value);
            this.target = target;
        }

        @Override
        public String toString() {
            return value + " -> bb" + target;
        }
    }

    /** Multi-way branch on an integer; {@code otherwise} is taken when no value matches. */
    public static final class SwitchInt extends SwitchTargets {
        public final IntegerTy ty;
        public final List<Branch> branches;
        public final int otherwise;

        public SwitchInt(IntegerTy ty, List<Branch> branches, int otherwise) {
            this.ty = Objects.requireNonNull(ty);
            this.branches = List.copyOf(branches);
            this.otherwise = otherwise;
        }

        @Override
        public List<Integer> targets() {
            List<Integer> targets = new ArrayList<>();
            branches.forEach(b -> targets.add(b.target));
            targets.add(otherwise);
            return targets;
        }

        @Override
        public SwitchTargets retarget(IntUnaryOperator f) {
            List<Branch> mapped = new ArrayList<>();
            branches.forEach(b -> mapped.add(new Branch(b.value, f.applyAsInt(b.target))));
            return new SwitchInt(ty, mapped, f.applyAsInt(otherwise));
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            branches.forEach(b -> sb.append(b).append(", "));
            return sb.append("_ -> bb").append(otherwise).toString();
        }
    }
}
