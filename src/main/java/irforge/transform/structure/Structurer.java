package irforge.transform.structure;

import irforge.base.graph.ControlFlowGraph;
import irforge.base.graph.Dominators;
import irforge.base.llbc.Block;
import irforge.base.llbc.Statement;
import irforge.base.meta.Span;
import irforge.base.types.TyStore;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.SwitchTargets;
import irforge.base.ullbc.Terminator;
import irforge.utils.Logging;

import java.util.*;

/**
 * Turns an unstructured body into a structured one.
 * <p>
 * The graph is first made reducible. Then, walking the dominator tree:
 * <ul>
 *   <li>the target of a back edge is a loop header, emitted as a {@code Loop} whose back edges
 *   become {@code Continue};</li>
 *   <li>a block with several forward in-edges is a merge block: it is emitted after a
 *   {@code Labeled} region holding the code of its immediate dominator, and the edges to it
 *   become {@code Break} out of that region;</li>
 *   <li>any other block is emitted in place of the only edge that reaches it.</li>
 * </ul>
 * Each block is thus emitted once, and no block id survives.
 */
public class Structurer {
    private final Body body;
    private final TyStore store;
    private ControlFlowGraph cfg;
    private Dominators dom;
    private final Set<Integer> loopHeaders = new HashSet<>();
    private final Map<Integer, Integer> forwardInEdges = new HashMap<>();
    private int nextLabel = 0;

    /** Enclosing constructs, innermost first. */
    private final Deque<Enclosing> context = new ArrayDeque<>();

    private static class Enclosing {
        final boolean isLoop;
        /** The loop header, or the merge block that follows the labeled region. */
        final int block;
        final int label;

        Enclosing(boolean isLoop, int block, int label) {
            this.isLoop = isLoop;
            this.block = block;
            this.label = label;
        }
    }

    public Structurer(Body body, TyStore store) {
        this.body = body;
        this.store = store;
    }

    public irforge.base.llbc.Body structure() {
        body.removeUnreachableBlocks();
        int dispatchLocals = new MakeReducible(body, store).run();
        if (dispatchLocals > 0) {
            Logging.debug("Structurer", String.format("Introduced %d dispatch locals", dispatchLocals));
        }
        cfg = new ControlFlowGraph(body);
        dom = new Dominators(cfg);
        for (int block : cfg.blocks()) {
            forwardInEdges.putIfAbsent(block, 0);
            for (int target : body.block(block).terminator.targets()) {
                if (isBackEdge(block, target)) {
                    loopHeaders.add(target);
                } else {
                    forwardInEdges.merge(target, 1, Integer::sum);
                }
            }
        }

        Block root = new Block(doTree(Body.ENTRY));
        irforge.base.llbc.Body result = new irforge.base.llbc.Body(body.span, body.locals, root);
        result.comments.addAll(body.comments);
        return result;
    }

    private boolean isBackEdge(int from, int to) {
        return dom.dominates(to, from);
    }

    private boolean isMerge(int block) {
        return forwardInEdges.getOrDefault(block, 0) >= 2;
    }

    /**
     * The code of the dominator subtree of {@code block}. Subtrees that come last in a list are
     * appended in a loop rather than by recursion, so the nesting depth only grows with the
     * nesting of branches, loops and labeled regions.
     */
    private List<Statement> doTree(int block) {
        List<Statement> statements = new ArrayList<>();
        appendTrees(block, statements);
        return statements;
    }

    private void appendTrees(Integer block, List<Statement> out) {
        while (block != null) {
            block = emitTree(block, out);
        }
    }

    /**
     * Append the code of the dominator subtree of {@code block} to {@code out}.
     * @return a block whose subtree must follow in the same list, or null
     */
    private Integer emitTree(int block, List<Statement> out) {
        List<Integer> mergeChildren = new ArrayList<>();
        for (int child : dom.children(block)) {
            if (isMerge(child)) {
                mergeChildren.add(child);
            }
        }
        // Latest in reverse post-order first: it ends up outermost, hence emitted last.
        mergeChildren.sort(Comparator.comparingInt((Integer b) -> dom.rpoNumber(b)).reversed());

        if (!loopHeaders.contains(block)) {
            return nodeWithin(block, mergeChildren, 0, out);
        }
        int label = nextLabel++;
        context.push(new Enclosing(true, block, label));
        List<Statement> loopBody = new ArrayList<>();
        try {
            appendTrees(nodeWithin(block, mergeChildren, 0, loopBody), loopBody);
        } finally {
            context.pop();
        }
        out.add(new Statement.Loop(body.block(block).terminator.span, label, new Block(loopBody)));
        return null;
    }

    private Integer nodeWithin(int block, List<Integer> mergeChildren, int next, List<Statement> out) {
        if (next == mergeChildren.size()) {
            BlockData data = body.block(block);
            data.statements.forEach(st -> out.add(StatementTranslator.translate(st)));
            return translateTerminator(block, data.terminator, out);
        }
        int follow = mergeChildren.get(next);
        int label = nextLabel++;
        context.push(new Enclosing(false, follow, label));
        List<Statement> inner = new ArrayList<>();
        try {
            appendTrees(nodeWithin(block, mergeChildren, next + 1, inner), inner);
        } finally {
            context.pop();
        }
        out.add(new Statement.Labeled(body.block(block).terminator.span, label, new Block(inner)));
        return follow;
    }

    private List<Statement> doBranch(Span span, int from, int to) {
        List<Statement> statements = new ArrayList<>();
        appendTrees(jump(span, from, to, statements), statements);
        return statements;
    }

    /**
     * Append the transfer from {@code from} to {@code to}.
     * @return {@code to} when its code goes in place of the edge, null otherwise
     */
    private Integer jump(Span span, int from, int to, List<Statement> out) {
        if (isBackEdge(from, to)) {
            out.add(new Statement.Continue(span, labelOf(true, to)));
            return null;
        } else if (isMerge(to)) {
            out.add(new Statement.Break(span, labelOf(false, to)));
            return null;
        }
        return to;
    }

    private int labelOf(boolean loop, int block) {
        for (Enclosing e : context) {
            if (e.isLoop == loop && e.block == block) {
                return e.label;
            }
        }
        throw new IllegalStateException(String.format("No enclosing %s for bb%d", loop ? "loop" : "region", block));
    }

    /**
     * Append the statements of a terminator. A single successor inlined at this point is returned
     * to the caller instead of being emitted here.
     */
    private Integer translateTerminator(int block, Terminator term, List<Statement> out) {
        Span span = term.span;
        if (term instanceof Terminator.Goto g) {
            return jump(span, block, g.target, out);
        } else if (term instanceof Terminator.Switch sw) {
            if (sw.targets instanceof SwitchTargets.If targets) {
                out.add(new Statement.If(span, sw.discr,
                        new Block(doBranch(span, block, targets.thenBlock)),
                        new Block(doBranch(span, block, targets.elseBlock))));
            } else {
                SwitchTargets.SwitchInt targets = (SwitchTargets.SwitchInt) sw.targets;
                List<Statement.SwitchBranch> branches = new ArrayList<>();
                for (SwitchTargets.Branch branch : targets.branches) {
                    branches.add(new Statement.SwitchBranch(branch.value, new Block(doBranch(span, block, branch.target))));
                }
                out.add(new Statement.SwitchInt(span, sw.discr, targets.ty, branches,
                        new Block(doBranch(span, block, targets.otherwise))));
            }
            return null;
        } else if (term instanceof Terminator.CallTerm call) {
            out.add(new Statement.CallStmt(span, call.call));
            return jump(span, block, call.target, out);
        } else if (term instanceof Terminator.Drop drop) {
            out.add(new Statement.Drop(span, drop.place));
            return jump(span, block, drop.target, out);
        } else if (term instanceof Terminator.Assert a) {
            out.add(new Statement.Assert(span, a.cond, a.expected));
            return jump(span, block, a.target, out);
        } else if (term instanceof Terminator.Return) {
            out.add(new Statement.Return(span));
        } else if (term instanceof Terminator.Panic) {
            out.add(new Statement.Abort(span));
        } else if (term instanceof Terminator.Unreachable) {
            out.add(new Statement.Unreachable(span));
        } else {
            throw new IllegalStateException("Unhandled terminator " + term.getClass().getSimpleName());
        }
        return null;
    }
}
