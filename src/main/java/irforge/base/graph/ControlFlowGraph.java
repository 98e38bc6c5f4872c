package irforge.base.graph;

import irforge.base.ullbc.Body;
import irforge.utils.Logging;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.alg.interfaces.StrongConnectivityAlgorithm;
import org.jgrapht.graph.AsSubgraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.*;

/**
 * Block graph of an unstructured body, restricted to the blocks reachable from the entry.
 * Parallel edges (a switch with several branches to the same block) are collapsed in the jgrapht
 * view; {@link #inEdgeCount(int)} keeps their multiplicity.
 */
public class ControlFlowGraph {
    private final Graph<Integer, DefaultEdge> graph;
    private final Map<Integer, List<Integer>> successors = new HashMap<>();
    private final Map<Integer, Integer> inEdgeCounts = new HashMap<>();
    private final List<Integer> reversePostOrder;

    public ControlFlowGraph(Body body) {
        graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (int id : body.reachableBlocks()) {
            graph.addVertex(id);
            inEdgeCounts.putIfAbsent(id, 0);
            List<Integer> succs = new ArrayList<>();
            for (int target : body.block(id).terminator.targets()) {
                graph.addVertex(target);
                graph.addEdge(id, target);
                inEdgeCounts.merge(target, 1, Integer::sum);
                if (!succs.contains(target)) {
                    succs.add(target);
                }
            }
            successors.put(id, succs);
        }
        reversePostOrder = computeReversePostOrder();
        Logging.trace("ControlFlowGraph", String.format("%d blocks, %d edges",
                graph.vertexSet().size(), graph.edgeSet().size()));
    }

    public Set<Integer> blocks() {
        return graph.vertexSet();
    }

    /** Distinct successors, in terminator order. */
    public List<Integer> successors(int block) {
        return successors.getOrDefault(block, List.of());
    }

    public List<Integer> predecessors(int block) {
        return Graphs.predecessorListOf(graph, block);
    }

    /** Number of terminator targets naming {@code block}, counting duplicates. */
    public int inEdgeCount(int block) {
        return inEdgeCounts.getOrDefault(block, 0);
    }

    public boolean hasSelfLoop(int block) {
        return graph.containsEdge(block, block);
    }

    public List<Integer> reversePostOrder() {
        return reversePostOrder;
    }

    /**
     * Strongly connected components of the subgraph induced by {@code region}. Trivial components
     * (a single block without a self loop) are omitted.
     */
    public List<Set<Integer>> cycles(Set<Integer> region) {
        Graph<Integer, DefaultEdge> sub = new AsSubgraph<>(graph, region);
        StrongConnectivityAlgorithm<Integer, DefaultEdge> scAlg = new KosarajuStrongConnectivityInspector<>(sub);
        List<Set<Integer>> result = new ArrayList<>();
        for (Set<Integer> scc : scAlg.stronglyConnectedSets()) {
            if (scc.size() > 1 || hasSelfLoop(scc.iterator().next())) {
                result.add(scc);
            }
        }
        return result;
    }

    private List<Integer> computeReversePostOrder() {
        List<Integer> postOrder = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        // Explicit stack of (block, next successor index) to stay iterative on long chains.
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{Body.ENTRY, 0});
        visited.add(Body.ENTRY);
        while (!stack.isEmpty()) {
            int[] top = stack.peek();
            List<Integer> succs = successors(top[0]);
            if (top[1] < succs.size()) {
                int next = succs.get(top[1]++);
                if (visited.add(next)) {
                    stack.push(new int[]{next, 0});
                }
            } else {
                postOrder.add(top[0]);
                stack.pop();
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }
}
