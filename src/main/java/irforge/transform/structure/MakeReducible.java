package irforge.transform.structure;

import irforge.base.expressions.ConstantExpr;
import irforge.base.expressions.Local;
import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.expressions.Rvalue;
import irforge.base.graph.ControlFlowGraph;
import irforge.base.types.IntegerTy;
import irforge.base.types.Literal;
import irforge.base.types.ScalarValue;
import irforge.base.types.Ty;
import irforge.base.types.TyStore;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Statement;
import irforge.base.ullbc.SwitchTargets;
import irforge.base.ullbc.Terminator;
import irforge.utils.Logging;

import java.util.*;

/**
 * Rewrites a body so that every cycle has a single entry block.
 * <p>
 * A strongly connected region entered at several blocks gets a dispatch block: every edge into
 * one of the entries first stores the index of that entry into a fresh {@code usize} local and
 * jumps to the dispatch block, which switches on the local to reach the entry. The dispatch block
 * is then the only entry of the region. Nested regions are handled in the same way, until the
 * graph is reducible.
 */
public class MakeReducible {
    private final Body body;
    private final TyStore store;
    private int dispatchLocals = 0;

    public MakeReducible(Body body, TyStore store) {
        this.body = body;
        this.store = store;
    }

    /**
     * @return the number of dispatch locals introduced
     */
    public int run() {
        boolean changed = true;
        while (changed) {
            changed = false;
            ControlFlowGraph cfg = new ControlFlowGraph(body);
            LinkedList<Set<Integer>> workList = new LinkedList<>();
            workList.add(new HashSet<>(cfg.blocks()));
            while (!workList.isEmpty() && !changed) {
                Set<Integer> region = workList.poll();
                for (Set<Integer> scc : cfg.cycles(region)) {
                    List<Integer> entries = entries(cfg, scc);
                    if (entries.size() > 1) {
                        insertDispatch(entries);
                        changed = true;
                        break;
                    }
                    Set<Integer> inner = new HashSet<>(scc);
                    inner.remove(entries.get(0));
                    if (!inner.isEmpty()) {
                        workList.add(inner);
                    }
                }
            }
        }
        return dispatchLocals;
    }

    /** Blocks of {@code scc} entered from outside of it, by increasing id. */
    private static List<Integer> entries(ControlFlowGraph cfg, Set<Integer> scc) {
        List<Integer> entries = new ArrayList<>();
        for (int block : scc) {
            boolean entered = block == Body.ENTRY;
            for (int pred : cfg.predecessors(block)) {
                if (!scc.contains(pred)) {
                    entered = true;
                    break;
                }
            }
            if (entered) {
                entries.add(block);
            }
        }
        Collections.sort(entries);
        return entries;
    }

    /** A region holding the function entry is only entered there, so it never gets here. */
    private void insertDispatch(List<Integer> entries) {
        Ty usize = store.integer(IntegerTy.USIZE);
        Local dispatch = body.locals.newVar(null, usize);
        dispatchLocals++;

        List<Integer> sources = new ArrayList<>(body.blocks.keySet());
        List<SwitchTargets.Branch> branches = new ArrayList<>();
        for (int i = 0; i < entries.size() - 1; i++) {
            branches.add(new SwitchTargets.Branch(ScalarValue.of(IntegerTy.USIZE, i), entries.get(i)));
        }
        int last = entries.get(entries.size() - 1);
        int dispatchBlock = body.newBlock(new BlockData(List.of(), new Terminator.Switch(body.span,
                Operand.copy(Place.local(dispatch.index)), new SwitchTargets.SwitchInt(IntegerTy.USIZE, branches, last))));

        // One setter block per (source, entry) pair.
        for (int source : sources) {
            BlockData block = body.block(source);
            Map<Integer, Integer> setters = new HashMap<>();
            block.terminator = block.terminator.retarget(target -> {
                int index = entries.indexOf(target);
                if (index < 0) {
                    return target;
                }
                return setters.computeIfAbsent(target, t -> body.newBlock(setter(dispatch, index, usize, dispatchBlock)));
            });
        }
        Logging.debug("MakeReducible", String.format("Irreducible region entered at %s, dispatch block bb%d",
                entries, dispatchBlock));
    }

    private BlockData setter(Local dispatch, int index, Ty usize, int dispatchBlock) {
        ConstantExpr value = new ConstantExpr.Lit(new Literal.Scalar(ScalarValue.of(IntegerTy.USIZE, index)), usize);
        Statement assign = new Statement.Assign(body.span, Place.local(dispatch.index), new Rvalue.Use(Operand.constant(value)));
        return new BlockData(List.of(assign), new Terminator.Goto(body.span, dispatchBlock));
    }
}
