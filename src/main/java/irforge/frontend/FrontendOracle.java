package irforge.frontend;

import java.util.List;
import java.util.Optional;

/**
 * Access to the type-checked program. Implementations wrap the compiler front end; the
 * translator only reads from it.
 */
public interface FrontendOracle {

    String crateName();

    /** Items defined in the crate being translated, in source order. */
    List<DefId> localItems();

    /**
     * The definition of {@code id}, or empty when the front end cannot provide it (external
     * item without metadata, item it failed to elaborate).
     */
    Optional<FrontItem> item(DefId id);
}
