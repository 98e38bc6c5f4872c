package irforge.frontend;

import irforge.base.expressions.BinOp;
import irforge.base.expressions.Place;
import irforge.base.expressions.UnOp;

import java.util.List;

public abstract class FrontRvalue {

    public static final class Use extends FrontRvalue {
        public final FrontOperand operand;

        public Use(FrontOperand operand) {
            this.operand = operand;
        }
    }

    public static final class Ref extends FrontRvalue {
        public final Place place;
        public final boolean mutable;

        public Ref(Place place, boolean mutable) {
            this.place = place;
            this.mutable = mutable;
        }
    }

    public static final class BinaryOp extends FrontRvalue {
        public final BinOp op;
        public final FrontOperand left;
        public final FrontOperand right;

        public BinaryOp(BinOp op, FrontOperand left, FrontOperand right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }
    }

    public static final class UnaryOp extends FrontRvalue {
        public final UnOp op;
        public final FrontOperand operand;

        public UnaryOp(UnOp op, FrontOperand operand) {
            this.op = op;
            this.operand = operand;
        }
    }

    public static final class Discriminant extends FrontRvalue {
        public final Place place;

        public Discriminant(Place place) {
            this.place = place;
        }
    }

    /** A tuple when {@code adt} is null, otherwise a struct or the given enum variant. */
    public static final class Aggregate extends FrontRvalue {
        public final DefId adt;
        public final Integer variant;
        public final FrontGenericArgs args;
        public final List<FrontOperand> operands;

        public Aggregate(DefId adt, Integer variant, FrontGenericArgs args, List<FrontOperand> operands) {
            this.adt = adt;
            this.variant = variant;
            this.args = args;
            this.operands = List.copyOf(operands);
        }
    }
}
