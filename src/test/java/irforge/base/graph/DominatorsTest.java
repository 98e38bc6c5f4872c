package irforge.base.graph;

import irforge.base.expressions.Locals;
import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.meta.Span;
import irforge.base.types.TyStore;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.SwitchTargets;
import irforge.base.ullbc.Terminator;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DominatorsTest {
    private TyStore store;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
    }

    private Body newBody() {
        Locals locals = new Locals(1);
        locals.newVar(null, store.unit());
        locals.newVar("c", store.bool());
        return new Body(Span.DUMMY, locals);
    }

    private static BlockData jump(int target) {
        return new BlockData(List.of(), new Terminator.Goto(Span.DUMMY, target));
    }

    private static BlockData branch(int thenBlock, int elseBlock) {
        return new BlockData(List.of(), new Terminator.Switch(Span.DUMMY, Operand.copy(Place.local(1)),
                new SwitchTargets.If(thenBlock, elseBlock)));
    }

    private static BlockData ret() {
        return new BlockData(List.of(), new Terminator.Return(Span.DUMMY));
    }

    @Test
    public void testDiamond() {
        Body body = newBody();
        body.newBlock(branch(1, 2));
        body.newBlock(jump(3));
        body.newBlock(jump(3));
        body.newBlock(ret());

        var cfg = new ControlFlowGraph(body);
        var dom = new Dominators(cfg);

        assertEquals(0, cfg.reversePostOrder().get(0));
        assertEquals(3, cfg.reversePostOrder().get(3));
        assertEquals(0, dom.idom(0));
        assertEquals(0, dom.idom(3));
        assertTrue(dom.dominates(0, 3));
        assertFalse(dom.dominates(1, 3));
        assertTrue(dom.dominates(1, 1));
        assertEquals(Set.of(1, 2, 3), Set.copyOf(dom.children(0)));
        assertEquals(2, cfg.inEdgeCount(3));
        assertTrue(cfg.cycles(cfg.blocks()).isEmpty());
    }

    @Test
    public void testLoop() {
        // 0 -> 1 -> {2 -> 1, 3}
        Body body = newBody();
        body.newBlock(jump(1));
        body.newBlock(branch(2, 3));
        body.newBlock(jump(1));
        body.newBlock(ret());

        var cfg = new ControlFlowGraph(body);
        var dom = new Dominators(cfg);

        assertTrue(dom.dominates(1, 2));
        assertEquals(1, dom.idom(3));
        assertEquals(List.of(Set.of(1, 2)), cfg.cycles(cfg.blocks()));
        assertEquals(Set.of(0, 2), Set.copyOf(cfg.predecessors(1)));
    }

    @Test
    public void testParallelEdgesAreCounted() {
        Body body = newBody();
        body.newBlock(branch(1, 1));
        body.newBlock(ret());
        // unreachable
        body.newBlock(jump(1));

        var cfg = new ControlFlowGraph(body);

        assertEquals(List.of(1), cfg.successors(0));
        assertEquals(2, cfg.inEdgeCount(1));
        assertEquals(Set.of(0, 1), cfg.blocks());
    }
}
