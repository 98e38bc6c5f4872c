package irforge.frontend;

/**
 * One step of a witness path, starting from the trait reached so far.
 */
public abstract class ImplExprPathChunk {
    /** The clause reached by this step. */
    public final FrontBinder<FrontTraitRef> predicate;
    /** Its index in the list of clauses of the current trait (or of the associated item). */
    public final int index;

    protected ImplExprPathChunk(FrontBinder<FrontTraitRef> predicate, int index) {
        this.predicate = predicate;
        this.index = index;
    }

    /** A clause on an associated type of the current trait. */
    public static final class AssocItem extends ImplExprPathChunk {
        public final String itemName;
        /** Generic arguments of the associated item itself. */
        public final FrontGenericArgs itemArgs;

        public AssocItem(String itemName, FrontGenericArgs itemArgs, FrontBinder<FrontTraitRef> predicate,
                         int index) {
            super(predicate, index);
            this.itemName = itemName;
            this.itemArgs = itemArgs;
        }
    }

    /** A supertrait clause of the current trait. */
    public static final class Parent extends ImplExprPathChunk {
        public Parent(FrontBinder<FrontTraitRef> predicate, int index) {
            super(predicate, index);
        }
    }
}
