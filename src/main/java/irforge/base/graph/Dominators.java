package irforge.base.graph;

import java.util.*;

/**
 * Dominator tree of a {@link ControlFlowGraph}, computed with the iterative algorithm of
 * Cooper, Harvey and Kennedy over the reverse post-order.
 */
public class Dominators {
    private final Map<Integer, Integer> rpoNumber = new HashMap<>();
    private final int[] idom;
    private final List<Integer> order;
    private final Map<Integer, List<Integer>> children = new HashMap<>();

    public Dominators(ControlFlowGraph cfg) {
        order = cfg.reversePostOrder();
        for (int i = 0; i < order.size(); i++) {
            rpoNumber.put(order.get(i), i);
        }
        idom = new int[order.size()];
        Arrays.fill(idom, -1);
        idom[0] = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 1; i < order.size(); i++) {
                int newIdom = -1;
                for (int pred : cfg.predecessors(order.get(i))) {
                    Integer p = rpoNumber.get(pred);
                    if (p == null || idom[p] == -1) {
                        continue;
                    }
                    newIdom = newIdom == -1 ? p : intersect(p, newIdom);
                }
                if (newIdom != idom[i]) {
                    idom[i] = newIdom;
                    changed = true;
                }
            }
        }
        for (int i = 1; i < order.size(); i++) {
            children.computeIfAbsent(order.get(idom[i]), k -> new ArrayList<>()).add(order.get(i));
        }
    }

    private int intersect(int a, int b) {
        while (a != b) {
            while (a > b) {
                a = idom[a];
            }
            while (b > a) {
                b = idom[b];
            }
        }
        return a;
    }

    public int rpoNumber(int block) {
        return rpoNumber.get(block);
    }

    /** The immediate dominator, or the block itself for the entry. */
    public int idom(int block) {
        return order.get(idom[rpoNumber(block)]);
    }

    /** Children in the dominator tree, in reverse post-order. */
    public List<Integer> children(int block) {
        return children.getOrDefault(block, List.of());
    }

    public boolean dominates(int a, int b) {
        int ra = rpoNumber(a);
        int rb = rpoNumber(b);
        while (rb > ra) {
            rb = idom[rb];
        }
        return ra == rb;
    }
}
