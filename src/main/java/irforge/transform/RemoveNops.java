package irforge.transform;

import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Statement;

public class RemoveNops implements Pass.UllbcPass {

    @Override
    public String name() {
        return "remove_nops";
    }

    @Override
    public void transformBody(TransformCtx ctx, Body body) {
        for (BlockData block : body.blocks.values()) {
            block.statements.removeIf(st -> st instanceof Statement.Nop);
        }
    }
}
