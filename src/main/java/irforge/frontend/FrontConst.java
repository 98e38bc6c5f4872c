package irforge.frontend;

import irforge.base.types.Literal;

/**
 * A const-generic argument.
 */
public abstract class FrontConst {

    public static final class Value extends FrontConst {
        public final Literal value;

        public Value(Literal value) {
            this.value = value;
        }
    }

    public static final class Param extends FrontConst {
        public final int index;

        public Param(int index) {
            this.index = index;
        }
    }

    public static final class Global extends FrontConst {
        public final DefId id;

        public Global(DefId id) {
            this.id = id;
        }
    }
}
