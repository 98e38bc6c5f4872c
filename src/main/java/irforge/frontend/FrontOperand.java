package irforge.frontend;

import irforge.base.expressions.Place;

public abstract class FrontOperand {

    public static final class Copy extends FrontOperand {
        public final Place place;

        public Copy(Place place) {
            this.place = place;
        }
    }

    public static final class Move extends FrontOperand {
        public final Place place;

        public Move(Place place) {
            this.place = place;
        }
    }

    public static final class Const extends FrontOperand {
        public final FrontConstant value;

        public Const(FrontConstant value) {
            this.value = value;
        }
    }
}
