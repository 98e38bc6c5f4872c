package irforge.transform;

import irforge.base.expressions.*;
import irforge.base.items.TranslatedCrate;
import irforge.base.meta.Span;
import irforge.base.types.IntegerTy;
import irforge.base.types.TyStore;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Statement;
import irforge.base.ullbc.Terminator;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RemoveArithmeticOverflowChecksTest {
    private TyStore store;
    private TransformCtx ctx;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
        ctx = new TransformCtx(new TranslatedCrate("test", store), new TranslateOptions(), new ErrorCtx(false));
    }

    /** {@code _0 u32, _1 u32, _2 (u32, bool)} */
    private Body newBody() {
        var u32 = store.integer(IntegerTy.U32);
        Locals locals = new Locals(1);
        locals.newVar(null, u32);
        locals.newVar("x", u32);
        locals.newVar(null, store.tuple(List.of(u32, store.bool())));
        return new Body(Span.DUMMY, locals);
    }

    /** {@code _2 = checked.+(copy _1, copy _1); assert(move _2.1 == false); _1 = move _2.0} */
    private static List<Statement> checkedIncrement() {
        Place tmp = Place.local(2);
        return List.of(
                new Statement.Assign(Span.DUMMY, tmp, new Rvalue.BinaryOp(BinOp.CHECKED_ADD,
                        Operand.copy(Place.local(1)), Operand.copy(Place.local(1)))),
                new Statement.Assert(Span.DUMMY, Operand.move(tmp.project(ProjectionElem.field(1))), false),
                new Statement.Assign(Span.DUMMY, Place.local(1),
                        new Rvalue.Use(Operand.move(tmp.project(ProjectionElem.field(0))))));
    }

    private static Statement copyToReturn() {
        return new Statement.Assign(Span.DUMMY, Place.local(0), new Rvalue.Use(Operand.copy(Place.local(1))));
    }

    @Test
    public void testEveryCheckedOperationInALongBlockIsRewritten() {
        int count = 30_000;
        List<Statement> statements = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            statements.addAll(checkedIncrement());
            statements.add(copyToReturn());
        }
        Body body = newBody();
        body.newBlock(new BlockData(statements, new Terminator.Return(Span.DUMMY)));

        new RemoveArithmeticOverflowChecks().transformBody(ctx, body);

        var result = body.block(Body.ENTRY).statements;
        assertEquals(2 * count, result.size());
        for (int i = 0; i < count; i++) {
            var assign = assertInstanceOf(Statement.Assign.class, result.get(2 * i));
            var op = assertInstanceOf(Rvalue.BinaryOp.class, assign.rvalue);
            assertEquals(BinOp.ADD, op.op);
            assertEquals(Place.local(1), assign.place);
            assertEquals(copyToReturn().toString(), result.get(2 * i + 1).toString());
        }
    }

    @Test
    public void testIncompleteSequenceIsKept() {
        List<Statement> statements = new ArrayList<>(checkedIncrement());
        // the checked result is read back in the wrong field
        statements.set(2, new Statement.Assign(Span.DUMMY, Place.local(1),
                new Rvalue.Use(Operand.move(Place.local(2).project(ProjectionElem.field(1))))));
        statements.addAll(checkedIncrement().subList(0, 2));
        Body body = newBody();
        body.newBlock(new BlockData(statements, new Terminator.Return(Span.DUMMY)));

        new RemoveArithmeticOverflowChecks().transformBody(ctx, body);

        assertEquals(5, body.block(Body.ENTRY).statements.size());
    }
}
