package irforge.transform;

/**
 * A transformation of the translated crate. Pass names are the ones accepted by the
 * {@code disabled_passes} option.
 */
public interface Pass {
    String name();

    /**
     * Runs on one unstructured body at a time. Passes of this kind may run concurrently on
     * different bodies and must only touch the body they are given.
     */
    interface UllbcPass extends Pass {
        void transformBody(TransformCtx ctx, irforge.base.ullbc.Body body);
    }

    /**
     * Runs on one structured body at a time, with the same constraints as {@link UllbcPass}.
     */
    interface LlbcPass extends Pass {
        void transformBody(TransformCtx ctx, irforge.base.llbc.Body body);
    }

    /**
     * Runs on the whole crate, alone, once every per-body pass is done.
     */
    interface CratePass extends Pass {
        void transformCrate(TransformCtx ctx);
    }
}
