package irforge.transform;

import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Terminator;
import irforge.utils.Logging;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

/**
 * Merges every block that is the target of a {@code Goto} and has no other antecedent into that
 * antecedent. Each block is copied at most once.
 */
public class MergeGotoChains implements Pass.UllbcPass {
    private static final int ZERO = -1;
    private static final int MANY = -2;

    @Override
    public String name() {
        return "merge_goto_chains";
    }

    /** The block that now holds the code of {@code id}. */
    private static int resolve(Map<Integer, Integer> mergedInto, int id) {
        int owner = id;
        while (mergedInto.containsKey(owner)) {
            owner = mergedInto.get(owner);
        }
        if (owner != id) {
            mergedInto.put(id, owner);
        }
        return owner;
    }

    @Override
    public void transformBody(TransformCtx ctx, Body body) {
        // Antecedent of each block: a block id when there is exactly one, ZERO or MANY otherwise.
        // A switch with two branches to the same block counts twice.
        Map<Integer, Integer> antecedents = new HashMap<>();
        for (int id : body.blocks.keySet()) {
            antecedents.put(id, ZERO);
        }
        for (var entry : body.blocks.entrySet()) {
            for (int target : entry.getValue().terminator.targets()) {
                antecedents.merge(target, entry.getKey(), (old, src) -> old == ZERO ? src : MANY);
            }
        }

        // Blocks merged away, mapped to the block that absorbed them.
        Map<Integer, Integer> mergedInto = new HashMap<>();
        int merged = 0;
        for (int start : new ArrayList<>(body.blocks.keySet())) {
            if (!body.blocks.containsKey(start)) {
                continue;
            }
            // Climb to the head of the goto chain first, so that statements are appended to the
            // head only once whatever the block order.
            int id = start;
            while (true) {
                int antecedent = antecedents.get(id);
                if (antecedent < 0) {
                    break;
                }
                int owner = resolve(mergedInto, antecedent);
                if (owner == start || !(body.block(owner).terminator instanceof Terminator.Goto g) || g.target != id) {
                    break;
                }
                id = owner;
            }
            BlockData source = body.block(id);
            while (source.terminator instanceof Terminator.Goto g && g.target != id && g.target != Body.ENTRY
                    && antecedents.getOrDefault(g.target, ZERO) >= 0) {
                BlockData target = body.blocks.remove(g.target);
                source.statements.addAll(target.statements);
                source.terminator = target.terminator;
                mergedInto.put(g.target, id);
                merged++;
            }
        }
        if (merged > 0) {
            Logging.trace("MergeGotoChains", String.format("Merged %d blocks, %d left", merged, body.blocks.size()));
        }
    }
}
