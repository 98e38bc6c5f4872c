package irforge.transform.structure;

import irforge.base.expressions.Locals;
import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.expressions.Rvalue;
import irforge.base.llbc.Statement;
import irforge.base.meta.Span;
import irforge.base.types.IntegerTy;
import irforge.base.types.ScalarValue;
import irforge.base.types.TyStore;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.SwitchTargets;
import irforge.base.ullbc.Terminator;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructurerTest {
    private TyStore store;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
    }

    /** Return place {@code _0: u32}, one argument {@code _1: bool}, and one scratch local {@code _2: u32}. */
    private Body newBody() {
        Locals locals = new Locals(1);
        locals.newVar(null, store.integer(IntegerTy.U32));
        locals.newVar("c", store.bool());
        locals.newVar("x", store.integer(IntegerTy.U32));
        return new Body(Span.DUMMY, locals);
    }

    /** A statement that tags the block it comes from. */
    private static irforge.base.ullbc.Statement mark(int tag) {
        return new irforge.base.ullbc.Statement.SetDiscriminant(Span.DUMMY, Place.local(2), tag);
    }

    private static BlockData block(int tag, Terminator term) {
        return new BlockData(List.of(mark(tag)), term);
    }

    private static Terminator jump(int target) {
        return new Terminator.Goto(Span.DUMMY, target);
    }

    private static Terminator branch(int thenBlock, int elseBlock) {
        return new Terminator.Switch(Span.DUMMY, Operand.copy(Place.local(1)), new SwitchTargets.If(thenBlock, elseBlock));
    }

    private static Terminator ret() {
        return new Terminator.Return(Span.DUMMY);
    }

    private static List<Integer> marks(irforge.base.llbc.Body body) {
        List<Integer> tags = new ArrayList<>();
        body.body.forEachStatement(st -> {
            if (st instanceof Statement.SetDiscriminant sd) {
                tags.add(sd.variant);
            }
        });
        return tags;
    }

    @Test
    public void testDiamondUsesLabeledRegion() {
        Body body = newBody();
        body.newBlock(block(0, branch(1, 2)));
        body.newBlock(block(1, jump(3)));
        body.newBlock(block(2, jump(3)));
        body.newBlock(block(3, ret()));

        var result = new Structurer(body, store).structure();
        var top = result.body.statements;

        assertEquals(3, top.size());
        var region = assertInstanceOf(Statement.Labeled.class, top.get(0));
        assertInstanceOf(Statement.SetDiscriminant.class, top.get(1));
        assertInstanceOf(Statement.Return.class, top.get(2));

        var inner = region.body.statements;
        var ifStmt = assertInstanceOf(Statement.If.class, inner.get(inner.size() - 1));
        var thenBreak = assertInstanceOf(Statement.Break.class, ifStmt.thenBlock.statements.get(1));
        var elseBreak = assertInstanceOf(Statement.Break.class, ifStmt.elseBlock.statements.get(1));
        assertEquals(region.label, thenBreak.label);
        assertEquals(region.label, elseBreak.label);
        assertEquals(List.of(0, 1, 2, 3), marks(result));
    }

    @Test
    public void testLoopWithContinue() {
        Body body = newBody();
        body.newBlock(block(0, jump(1)));
        body.newBlock(block(1, branch(2, 3)));
        body.newBlock(block(2, jump(1)));
        body.newBlock(block(3, ret()));

        var result = new Structurer(body, store).structure();
        var top = result.body.statements;

        assertEquals(2, top.size());
        var loop = assertInstanceOf(Statement.Loop.class, top.get(1));
        var ifStmt = assertInstanceOf(Statement.If.class, loop.body.statements.get(1));
        var cont = assertInstanceOf(Statement.Continue.class, ifStmt.thenBlock.statements.get(1));
        assertEquals(loop.label, cont.label);
        assertInstanceOf(Statement.Return.class, ifStmt.elseBlock.statements.get(1));
        assertEquals(List.of(0, 1, 2, 3), marks(result));
    }

    @Test
    public void testSwitchKeepsBranchOrder() {
        Body body = newBody();
        var targets = new SwitchTargets.SwitchInt(IntegerTy.U32, List.of(
                new SwitchTargets.Branch(ScalarValue.of(IntegerTy.U32, 7), 3),
                new SwitchTargets.Branch(ScalarValue.of(IntegerTy.U32, 2), 1)), 2);
        body.newBlock(block(0, new Terminator.Switch(Span.DUMMY, Operand.copy(Place.local(2)), targets)));
        body.newBlock(block(1, ret()));
        body.newBlock(block(2, new Terminator.Panic(Span.DUMMY)));
        body.newBlock(block(3, ret()));

        var result = new Structurer(body, store).structure();
        var sw = assertInstanceOf(Statement.SwitchInt.class, result.body.statements.get(1));

        assertEquals(ScalarValue.of(IntegerTy.U32, 7), sw.branches.get(0).value);
        assertEquals(ScalarValue.of(IntegerTy.U32, 2), sw.branches.get(1).value);
        assertInstanceOf(Statement.SetDiscriminant.class, sw.branches.get(0).block.statements.get(0));
        assertEquals(3, ((Statement.SetDiscriminant) sw.branches.get(0).block.statements.get(0)).variant);
        assertEquals(1, ((Statement.SetDiscriminant) sw.branches.get(1).block.statements.get(0)).variant);
        assertInstanceOf(Statement.Abort.class, sw.otherwise.statements.get(1));
    }

    @Test
    public void testEveryBlockEmittedOnce() {
        // Nested loops with an early exit and a shared tail.
        Body body = newBody();
        body.newBlock(block(0, jump(1)));
        body.newBlock(block(1, branch(2, 6)));
        body.newBlock(block(2, branch(3, 4)));
        body.newBlock(block(3, jump(2)));
        body.newBlock(block(4, branch(5, 7)));
        body.newBlock(block(5, jump(1)));
        body.newBlock(block(6, jump(7)));
        body.newBlock(block(7, ret()));

        var result = new Structurer(body, store).structure();

        var tags = marks(result);
        tags.sort(Integer::compareTo);
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), tags);
    }

    @Test
    public void testUnreachableBlocksAreDropped() {
        Body body = newBody();
        body.newBlock(block(0, ret()));
        body.newBlock(block(1, jump(0)));

        var result = new Structurer(body, store).structure();

        assertEquals(List.of(0), marks(result));
    }

    @Test
    public void testIrreducibleGraphGetsOneDispatchLocal() {
        Body body = newBody();
        body.newBlock(block(0, branch(1, 2)));
        body.newBlock(block(1, jump(2)));
        body.newBlock(block(2, branch(1, 3)));
        body.newBlock(block(3, ret()));
        int localsBefore = body.locals.size();

        var result = new Structurer(body, store).structure();

        assertEquals(localsBefore + 1, result.locals.size());
        assertEquals(store.integer(IntegerTy.USIZE), result.locals.vars.get(localsBefore).ty);
        List<Statement> loops = new ArrayList<>();
        result.body.forEachStatement(st -> {
            if (st instanceof Statement.Loop) {
                loops.add(st);
            }
        });
        assertEquals(1, loops.size());
        var tags = marks(result);
        tags.sort(Integer::compareTo);
        assertEquals(List.of(0, 1, 2, 3), tags);
    }

    @Test
    public void testLoopThroughEntryIsReducible() {
        Body body = newBody();
        body.newBlock(block(0, branch(1, 2)));
        body.newBlock(block(1, branch(0, 3)));
        body.newBlock(block(2, jump(1)));
        body.newBlock(block(3, ret()));

        assertEquals(0, new MakeReducible(body, store).run());

        var result = new Structurer(body, store).structure();
        assertEquals(1, result.body.statements.size());
        assertInstanceOf(Statement.Loop.class, result.body.statements.get(0));
        var tags = marks(result);
        tags.sort(Integer::compareTo);
        assertEquals(List.of(0, 1, 2, 3), tags);
    }
}
