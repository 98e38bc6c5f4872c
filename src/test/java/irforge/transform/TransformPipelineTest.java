package irforge.transform;

import irforge.base.expressions.*;
import irforge.base.items.*;
import irforge.base.llbc.Statement;
import irforge.base.meta.Span;
import irforge.base.types.AnyDeclId;
import irforge.base.types.GenericParams;
import irforge.base.types.IntegerTy;
import irforge.base.types.TyStore;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Terminator;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

public class TransformPipelineTest {
    private TyStore store;
    private TranslatedCrate crate;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
        crate = new TranslatedCrate("test", store);
    }

    /**
     * {@code fn add(a: u32, b: u32) -> u32 { a + b }} as lowered with overflow checks:
     * <pre>
     * bb0: _3 = checked.+(copy _1, copy _2); assert(move _3.1 == false) -> bb1
     * bb1: _0 = move _3.0; return
     * </pre>
     */
    private FunDecl checkedAdd() {
        var u32 = store.integer(IntegerTy.U32);
        Locals locals = new Locals(2);
        locals.newVar(null, u32);
        locals.newVar("a", u32);
        locals.newVar("b", u32);
        locals.newVar(null, store.tuple(List.of(u32, store.bool())));
        Body body = new Body(Span.DUMMY, locals);
        Place tmp = Place.local(3);
        var checked = new irforge.base.ullbc.Statement.Assign(Span.DUMMY, tmp, new Rvalue.BinaryOp(BinOp.CHECKED_ADD,
                Operand.copy(Place.local(1)), Operand.copy(Place.local(2))));
        body.newBlock(new BlockData(List.of(checked), new Terminator.Assert(Span.DUMMY,
                Operand.move(tmp.project(ProjectionElem.field(1))), false, 1)));
        var use = new irforge.base.ullbc.Statement.Assign(Span.DUMMY, Place.local(0),
                new Rvalue.Use(Operand.move(tmp.project(ProjectionElem.field(0)))));
        body.newBlock(new BlockData(List.of(use), new Terminator.Return(Span.DUMMY)));

        var meta = new ItemMeta("test::add", Span.DUMMY, true, true);
        FunDecl fun = new FunDecl(AnyDeclId.fun(0), meta, new GenericParams(), new FunSig(false, List.of(u32, u32), u32),
                ItemKind.REGULAR, null);
        fun.unstructuredBody = body;
        return fun;
    }

    private FunDecl unitFun(int index) {
        Locals locals = new Locals(0);
        locals.newVar(null, store.unit());
        Body body = new Body(Span.DUMMY, locals);
        body.newBlock(new BlockData(List.of(), new Terminator.Return(Span.DUMMY)));
        var meta = new ItemMeta("test::f" + index, Span.DUMMY, true, true);
        FunDecl fun = new FunDecl(AnyDeclId.fun(index), meta, new GenericParams(),
                new FunSig(false, List.of(), store.unit()), ItemKind.REGULAR, null);
        fun.unstructuredBody = body;
        return fun;
    }

    @Test
    public void testCheckedAdditionBecomesOneBinaryOp() {
        crate.addItem(checkedAdd());
        var options = new TranslateOptions();
        options.threads = 2;

        new TransformPipeline(new TransformCtx(crate, options, new ErrorCtx(false))).run();

        FunDecl fun = crate.funDecls.get(AnyDeclId.fun(0));
        assertNull(fun.unstructuredBody);
        var statements = fun.structuredBody.body.statements;
        assertEquals(2, statements.size());
        var assign = assertInstanceOf(Statement.Assign.class, statements.get(0));
        var op = assertInstanceOf(Rvalue.BinaryOp.class, assign.rvalue);
        assertEquals(BinOp.ADD, op.op);
        assertEquals(Place.local(0), assign.place);
        assertInstanceOf(Statement.Return.class, statements.get(1));
        // the overflow tuple is gone
        assertEquals(3, fun.structuredBody.locals.size());
        assertEquals(List.of(DeclarationGroup.nonRec(fun.id).toString()),
                crate.orderedDecls.stream().map(Object::toString).toList());
    }

    @Test
    public void testDisabledPassIsSkipped() {
        crate.addItem(checkedAdd());
        var options = TranslateOptions.fromArgs("disabled_passes=remove_arithmetic_overflow_checks", "threads=1");

        new TransformPipeline(new TransformCtx(crate, options, new ErrorCtx(false))).run();

        var statements = crate.funDecls.get(AnyDeclId.fun(0)).structuredBody.body.statements;
        assertEquals(4, statements.size());
        assertInstanceOf(Statement.Assert.class, statements.get(1));
    }

    @Test
    public void testFailingBodyCancelsTheOthers() throws Exception {
        for (int i = 0; i < 4; i++) {
            crate.addItem(unitFun(i));
        }
        var options = new TranslateOptions();
        options.threads = 2;
        var pipeline = spy(new TransformPipeline(new TransformCtx(crate, options, new ErrorCtx(false))));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        doAnswer(inv -> {
            FunDecl fun = inv.getArgument(0);
            if (fun.id.equals(AnyDeclId.fun(0))) {
                assertTrue(started.await(10, TimeUnit.SECONDS));
                throw new IllegalStateException("broken body");
            }
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        }).when(pipeline).transformFun(any());

        var err = assertThrows(IllegalStateException.class, pipeline::run);

        assertEquals("broken body", err.getMessage());
        // the body still running was interrupted rather than left to finish
        assertTrue(interrupted.await(10, TimeUnit.SECONDS));
        assertTrue(crate.orderedDecls.isEmpty());
    }
}
