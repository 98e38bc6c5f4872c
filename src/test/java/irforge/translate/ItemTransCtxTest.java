package irforge.translate;

import irforge.base.types.*;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;
import irforge.errors.TranslationError;
import irforge.frontend.*;
import irforge.base.meta.Span;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ItemTransCtxTest {
    private static final Span SPAN = Span.line("lib.rs", 1, 1, 10);

    @Mock
    private FrontendOracle oracle;

    private ItemTransCtx ctx;

    @BeforeEach
    public void setUp() {
        Logging.init();
        when(oracle.crateName()).thenReturn("test");
        var t = new TranslateCtx(oracle, new TranslateOptions(), new ErrorCtx(false));
        var def = new DefId("test", "f", DefId.Kind.FN);
        ctx = new ItemTransCtx(t, t.registerId(SPAN, def), def);
        ctx.pushRegionParam("'a");
        ctx.pushTypeParam("T");
    }

    private static FrontTy refTo(FrontRegion region) {
        return new FrontTy.Ref(region, FrontTy.integer(IntegerTy.U32), false);
    }

    @Test
    public void testEarlyBoundRegionDepthFollowsBinders() {
        // fn(&'a u32) at the item level, then inside for<'x> fn(&'x u32, &'a u32)
        Ty outer = ctx.translateTy(SPAN, refTo(new FrontRegion.EarlyParam(0)));
        assertEquals(Region.bound(0, 0), ((TyKind.Ref) outer.kind()).region);

        var sig = new FrontFnSig(false, List.of(refTo(new FrontRegion.Bound(0, 0)), refTo(new FrontRegion.EarlyParam(0))),
                FrontTy.tuple());
        Ty arrow = ctx.translateTy(SPAN, new FrontTy.Arrow(new FrontBinder<>(List.of("'x"), sig)));

        var inner = ((TyKind.Arrow) arrow.kind()).sig;
        assertEquals(1, inner.regions.size());
        var local = (TyKind.Ref) inner.skipBinder.inputs.get(0).kind();
        var param = (TyKind.Ref) inner.skipBinder.inputs.get(1).kind();
        assertEquals(Region.bound(0, 0), local.region);
        assertEquals(Region.bound(1, 0), param.region);
        // same front-end type, different depth: different handles
        assertNotSame(outer, inner.skipBinder.inputs.get(1));
        assertSame(outer, ctx.translateTy(SPAN, refTo(new FrontRegion.EarlyParam(0))));
        assertEquals(0, ctx.innerBinderDepth());
    }

    @Test
    public void testEscapingBoundRegionIsRejected() {
        var err = assertThrows(TranslationError.class, () -> ctx.translateTy(SPAN, refTo(new FrontRegion.Bound(0, 0))));
        assertEquals(TranslationError.Kind.RESOLUTION_FAILURE, err.kind);
        assertEquals(0, ctx.innerBinderDepth());
    }

    @Test
    public void testUnknownTypeParameterIsRejected() {
        var err = assertThrows(TranslationError.class, () -> ctx.translateTy(SPAN, FrontTy.param(3, "U")));
        assertEquals(TranslationError.Kind.RESOLUTION_FAILURE, err.kind);
        assertSame(ctx.store().typeVar(0), ctx.translateTy(SPAN, FrontTy.param(0, "T")));
    }

    @Test
    public void testBindersCloseInOrder() {
        var outer = ctx.openBinder(SPAN, List.of("'x"));
        var inner = ctx.openBinder(SPAN, List.of("'y", "'z"));
        assertEquals(2, ctx.innerBinderDepth());
        assertThrows(IllegalStateException.class, outer::close);
        inner.close();
        outer.close();
        assertEquals(0, ctx.innerBinderDepth());
    }
}
