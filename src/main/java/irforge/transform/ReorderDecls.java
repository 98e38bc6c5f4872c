package irforge.transform;

import irforge.base.items.DeclarationGroup;
import irforge.base.items.ItemDecl;
import irforge.base.types.AnyDeclId;
import irforge.base.types.Ty;
import irforge.base.types.TypeVisitor;
import irforge.utils.Logging;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;

import java.util.*;

/**
 * Computes {@link irforge.base.items.TranslatedCrate#orderedDecls}: items grouped by mutual
 * recursion, every group placed after the groups it depends on.
 */
public class ReorderDecls implements Pass.CratePass {

    @Override
    public String name() {
        return "reorder_decls";
    }

    @Override
    public void transformCrate(TransformCtx ctx) {
        var crate = ctx.crate;
        Graph<AnyDeclId, DefaultEdge> deps = new DefaultDirectedGraph<>(DefaultEdge.class);
        List<ItemDecl> items = crate.allItems();
        items.forEach(item -> deps.addVertex(item.id));

        Set<AnyDeclId> selfReferencing = new HashSet<>();
        for (ItemDecl item : items) {
            for (AnyDeclId dep : dependencies(item)) {
                if (!deps.containsVertex(dep)) {
                    continue;
                }
                if (dep.equals(item.id)) {
                    selfReferencing.add(dep);
                } else {
                    // dependency -> dependent, so a topological order lists dependencies first
                    deps.addEdge(dep, item.id);
                }
            }
        }

        var inspector = new KosarajuStrongConnectivityInspector<>(deps);
        List<Set<AnyDeclId>> sccs = inspector.stronglyConnectedSets();
        Map<AnyDeclId, Integer> sccOf = new HashMap<>();
        List<List<AnyDeclId>> members = new ArrayList<>();
        for (int i = 0; i < sccs.size(); i++) {
            List<AnyDeclId> sorted = new ArrayList<>(sccs.get(i));
            Collections.sort(sorted);
            members.add(sorted);
            for (AnyDeclId id : sorted) {
                sccOf.put(id, i);
            }
        }

        Graph<Integer, DefaultEdge> condensed = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (int i = 0; i < members.size(); i++) {
            condensed.addVertex(i);
        }
        for (DefaultEdge edge : deps.edgeSet()) {
            int from = sccOf.get(deps.getEdgeSource(edge));
            int to = sccOf.get(deps.getEdgeTarget(edge));
            if (from != to) {
                condensed.addEdge(from, to);
            }
        }

        Comparator<Integer> byFirstItem = Comparator.comparing(i -> members.get(i).get(0));
        var iterator = new TopologicalOrderIterator<>(condensed, byFirstItem);
        crate.orderedDecls.clear();
        while (iterator.hasNext()) {
            List<AnyDeclId> group = members.get(iterator.next());
            if (group.size() == 1 && !selfReferencing.contains(group.get(0))) {
                crate.orderedDecls.add(DeclarationGroup.nonRec(group.get(0)));
            } else {
                crate.orderedDecls.add(DeclarationGroup.rec(group));
            }
        }
        Logging.debug("ReorderDecls", String.format("%d items in %d declaration groups",
                items.size(), crate.orderedDecls.size()));
    }

    static Set<AnyDeclId> dependencies(ItemDecl item) {
        Set<AnyDeclId> found = new LinkedHashSet<>();
        item.visitTypes(new TypeVisitor() {
            private final Set<Ty> seen = Collections.newSetFromMap(new IdentityHashMap<>());

            @Override
            public void visitTy(Ty ty) {
                if (seen.add(ty)) {
                    visitInside(ty);
                }
            }

            @Override
            public void visitDeclId(AnyDeclId id) {
                found.add(id);
            }
        });
        return found;
    }
}
