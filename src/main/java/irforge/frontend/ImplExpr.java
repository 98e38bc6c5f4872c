package irforge.frontend;

/**
 * The front end's witness that {@code trait} holds, and how.
 */
public class ImplExpr {
    public final FrontBinder<FrontTraitRef> trait;
    public final ImplExprAtom atom;

    public ImplExpr(FrontBinder<FrontTraitRef> trait, ImplExprAtom atom) {
        this.trait = trait;
        this.atom = atom;
    }
}
