package irforge.frontend;

/**
 * {@code Self: Trait<Args>}; the self type is the first type argument.
 */
public class FrontTraitRef {
    public final DefId traitId;
    public final FrontGenericArgs args;

    public FrontTraitRef(DefId traitId, FrontGenericArgs args) {
        this.traitId = traitId;
        this.args = args;
    }
}
