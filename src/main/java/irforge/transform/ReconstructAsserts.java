package irforge.transform;

import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Statement;
import irforge.base.ullbc.Terminator;

/**
 * Turns every {@code Assert} terminator into an {@code Assert} statement followed by a goto, so
 * that the goto chains it was part of can be merged.
 */
public class ReconstructAsserts implements Pass.UllbcPass {

    @Override
    public String name() {
        return "reconstruct_asserts";
    }

    @Override
    public void transformBody(TransformCtx ctx, Body body) {
        for (BlockData block : body.blocks.values()) {
            if (block.terminator instanceof Terminator.Assert a) {
                block.statements.add(new Statement.Assert(a.span, a.cond, a.expected));
                block.terminator = new Terminator.Goto(a.span, a.target);
            }
        }
    }
}
