package irforge.frontend;

import irforge.base.expressions.Place;
import irforge.base.meta.Span;

public abstract class FrontStatement {
    public final Span span;

    protected FrontStatement(Span span) {
        this.span = span;
    }

    public static final class Assign extends FrontStatement {
        public final Place place;
        public final FrontRvalue rvalue;

        public Assign(Span span, Place place, FrontRvalue rvalue) {
            super(span);
            this.place = place;
            this.rvalue = rvalue;
        }
    }

    public static final class FakeRead extends FrontStatement {
        public final Place place;

        public FakeRead(Span span, Place place) {
            super(span);
            this.place = place;
        }
    }

    public static final class SetDiscriminant extends FrontStatement {
        public final Place place;
        public final int variant;

        public SetDiscriminant(Span span, Place place, int variant) {
            super(span);
            this.place = place;
            this.variant = variant;
        }
    }

    public static final class StorageLive extends FrontStatement {
        public final int local;

        public StorageLive(Span span, int local) {
            super(span);
            this.local = local;
        }
    }

    public static final class StorageDead extends FrontStatement {
        public final int local;

        public StorageDead(Span span, int local) {
            super(span);
            this.local = local;
        }
    }

    public static final class Deinit extends FrontStatement {
        public final Place place;

        public Deinit(Span span, Place place) {
            super(span);
            this.place = place;
        }
    }

    public static final class Nop extends FrontStatement {
        public Nop(Span span) {
            super(span);
        }
    }
}
