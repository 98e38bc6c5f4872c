package irforge.transform;

import irforge.base.expressions.*;
import irforge.base.items.*;
import irforge.base.meta.Span;
import irforge.base.types.*;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Terminator;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReorderDeclsTest {
    private TyStore store;
    private TranslatedCrate crate;
    private TransformCtx ctx;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
        crate = new TranslatedCrate("test", store);
        ctx = new TransformCtx(crate, new TranslateOptions(), new ErrorCtx(false));
    }

    private static ItemMeta meta(String name) {
        return new ItemMeta(name, Span.DUMMY, true, true);
    }

    private Ty adt(int index) {
        return store.adt(AnyDeclId.type(index), GenericArgs.empty(GenericsSource.item(AnyDeclId.type(index))));
    }

    private void struct(int index, Ty... fieldTys) {
        List<Field> fields = new java.util.ArrayList<>();
        for (int i = 0; i < fieldTys.length; i++) {
            fields.add(new Field(Span.DUMMY, "f" + i, fieldTys[i]));
        }
        crate.addItem(new TypeDecl(AnyDeclId.type(index), meta("test::T" + index), new GenericParams(),
                new TypeDeclKind.Struct(fields)));
    }

    /** A function taking {@code input} and calling {@code callee}, if any. */
    private void fun(int index, Ty input, Integer callee) {
        Locals locals = new Locals(1);
        locals.newVar(null, store.unit());
        locals.newVar("x", input);
        Body body = new Body(Span.DUMMY, locals);
        if (callee != null) {
            var target = AnyDeclId.fun(callee);
            var call = new Call(FnOperand.regular(FnPtr.regular(target, GenericArgs.empty(GenericsSource.item(target)))),
                    List.of(), Place.local(0));
            body.newBlock(new BlockData(List.of(), new Terminator.CallTerm(Span.DUMMY, call, 1)));
        }
        body.newBlock(new BlockData(List.of(), new Terminator.Return(Span.DUMMY)));
        var decl = new FunDecl(AnyDeclId.fun(index), meta("test::f" + index), new GenericParams(),
                new FunSig(false, List.of(input), store.unit()), ItemKind.REGULAR, null);
        decl.unstructuredBody = body;
        crate.addItem(decl);
    }

    private List<String> groups() {
        return crate.orderedDecls.stream().map(Object::toString).toList();
    }

    @Test
    public void testDependenciesComeFirst() {
        struct(0, adt(1));
        struct(1, store.bool());
        fun(0, adt(0), null);

        new ReorderDecls().transformCrate(ctx);

        assertEquals(List.of(
                DeclarationGroup.nonRec(AnyDeclId.type(1)).toString(),
                DeclarationGroup.nonRec(AnyDeclId.type(0)).toString(),
                DeclarationGroup.nonRec(AnyDeclId.fun(0)).toString()), groups());
    }

    @Test
    public void testMutualRecursionFormsOneGroup() {
        struct(0, store.bool());
        fun(0, adt(0), 1);
        fun(1, store.bool(), 0);
        fun(2, store.bool(), 2);

        new ReorderDecls().transformCrate(ctx);

        assertEquals(List.of(
                DeclarationGroup.nonRec(AnyDeclId.type(0)).toString(),
                DeclarationGroup.rec(List.of(AnyDeclId.fun(0), AnyDeclId.fun(1))).toString(),
                DeclarationGroup.rec(List.of(AnyDeclId.fun(2))).toString()), groups());
    }

    @Test
    public void testIndependentItemsKeepDeclarationOrder() {
        fun(2, store.bool(), null);
        fun(0, store.bool(), null);
        struct(3, store.unit());
        fun(1, store.bool(), null);

        new ReorderDecls().transformCrate(ctx);

        assertEquals(List.of(
                DeclarationGroup.nonRec(AnyDeclId.type(3)).toString(),
                DeclarationGroup.nonRec(AnyDeclId.fun(0)).toString(),
                DeclarationGroup.nonRec(AnyDeclId.fun(1)).toString(),
                DeclarationGroup.nonRec(AnyDeclId.fun(2)).toString()), groups());
    }
}
