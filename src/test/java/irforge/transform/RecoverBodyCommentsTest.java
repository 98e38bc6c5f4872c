package irforge.transform;

import irforge.base.expressions.Locals;
import irforge.base.expressions.Place;
import irforge.base.items.TranslatedCrate;
import irforge.base.llbc.Block;
import irforge.base.llbc.Body;
import irforge.base.llbc.Statement;
import irforge.base.meta.SourceComment;
import irforge.base.meta.Span;
import irforge.base.types.TyStore;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RecoverBodyCommentsTest {
    private TyStore store;
    private TransformCtx ctx;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
        ctx = new TransformCtx(new TranslatedCrate("test", store), new TranslateOptions(), new ErrorCtx(false));
    }

    private Locals locals() {
        Locals locals = new Locals(0);
        locals.newVar(null, store.unit());
        return locals;
    }

    private static Span at(int line, int begCol, int endCol) {
        return Span.line("lib.rs", line, begCol, endCol);
    }

    @Test
    public void testCommentGoesToEarliestStatementOfLine() {
        var fakeRead = new Statement.FakeRead(at(3, 1, 30), Place.local(0));
        var inner = new Statement.StorageDead(at(3, 9, 12), 0);
        var outer = new Statement.SetDiscriminant(at(3, 5, 20), Place.local(0), 0);
        var sameStartShorter = new Statement.Deinit(at(3, 5, 10), Place.local(0));
        var ret = new Statement.Return(at(4, 5, 11));
        var body = new Body(Span.DUMMY, locals(), new Block(List.of(fakeRead, inner, sameStartShorter, outer, ret)));
        body.comments.add(new SourceComment(3, "set the tag"));
        body.comments.add(new SourceComment(4, "done"));

        new RecoverBodyComments().transformBody(ctx, body);

        assertEquals(List.of("set the tag"), outer.comments);
        assertTrue(fakeRead.comments.isEmpty());
        assertTrue(inner.comments.isEmpty());
        assertTrue(sameStartShorter.comments.isEmpty());
        assertEquals(List.of("done"), ret.comments);
    }

    @Test
    public void testNestedStatementsAreConsidered() {
        var thenRet = new Statement.Return(at(7, 9, 15));
        var elseAbort = new Statement.Abort(at(9, 9, 16));
        var ifStmt = new Statement.If(at(6, 5, 40), irforge.base.expressions.Operand.copy(Place.local(0)),
                new Block(List.of(thenRet)), new Block(List.of(elseAbort)));
        var body = new Body(Span.DUMMY, locals(), new Block(List.of(ifStmt)));
        body.comments.add(new SourceComment(6, "branch"));
        body.comments.add(new SourceComment(9, "give up"));
        body.comments.add(new SourceComment(12, "dangling"));

        new RecoverBodyComments().transformBody(ctx, body);

        assertEquals(List.of("branch"), ifStmt.comments);
        assertTrue(thenRet.comments.isEmpty());
        assertEquals(List.of("give up"), elseAbort.comments);
    }

    @Test
    public void testEachCommentAssignedOnce() {
        var first = new Statement.Nop(at(2, 5, 10));
        var copy = new Statement.Nop(at(2, 5, 10));
        var body = new Body(Span.DUMMY, locals(), new Block(List.of(first, copy)));
        body.comments.add(new SourceComment(2, "once"));

        new RecoverBodyComments().transformBody(ctx, body);

        assertEquals(List.of("once"), first.comments);
        assertTrue(copy.comments.isEmpty());
    }
}
