package irforge.transform;

import irforge.base.expressions.Local;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Statement;
import irforge.utils.Logging;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Removes the locals that are only mentioned by {@code StorageDead} statements, together with
 * those statements, and renumbers the remaining locals densely. The return place and the
 * arguments are always kept.
 */
public class RemoveUnusedLocals implements Pass.UllbcPass {

    @Override
    public String name() {
        return "remove_unused_locals";
    }

    @Override
    public void transformBody(TransformCtx ctx, Body body) {
        int count = body.locals.size();
        BitSet used = new BitSet(count);
        for (int i = 0; i < count; i++) {
            if (body.locals.isSignatureLocal(i)) {
                used.set(i);
            }
        }
        for (BlockData block : body.blocks.values()) {
            for (Statement st : block.statements) {
                if (!(st instanceof Statement.StorageDead)) {
                    st.forEachLocal(used::set);
                }
            }
            block.terminator.forEachLocal(used::set);
        }
        if (used.cardinality() == count) {
            return;
        }

        int[] newIndex = new int[count];
        List<Local> kept = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            if (used.get(i)) {
                newIndex[i] = kept.size();
                kept.add(body.locals.vars.get(i).withIndex(kept.size()));
            } else {
                newIndex[i] = -1;
            }
        }
        for (BlockData block : body.blocks.values()) {
            block.statements.removeIf(st -> st instanceof Statement.StorageDead dead && !used.get(dead.local));
            block.statements.replaceAll(st -> st.mapLocals(l -> newIndex[l]));
            block.terminator = block.terminator.mapLocals(l -> newIndex[l]);
        }
        body.locals.vars.clear();
        body.locals.vars.addAll(kept);
        Logging.trace("RemoveUnusedLocals", String.format("Removed %d locals", count - kept.size()));
    }
}
