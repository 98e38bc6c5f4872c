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

public class RemoveUnusedSelfClauseTest {
    private static final AnyDeclId TRAIT = AnyDeclId.traitDecl(0);
    private static final AnyDeclId OTHER_TRAIT = AnyDeclId.traitDecl(1);

    private TyStore store;
    private TranslatedCrate crate;
    private TransformCtx ctx;
    private TraitDecl trait;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
        crate = new TranslatedCrate("test", store);
        ctx = new TransformCtx(crate, new TranslateOptions(), new ErrorCtx(false));

        var traitGenerics = new GenericParams();
        traitGenerics.types.add(new TypeVar(0, "Self"));
        trait = new TraitDecl(TRAIT, meta("test::Trait"), traitGenerics);
        crate.addItem(trait);
        crate.addItem(new TraitDecl(OTHER_TRAIT, meta("test::Other"), new GenericParams()));
    }

    private static ItemMeta meta(String name) {
        return new ItemMeta(name, Span.DUMMY, true, true);
    }

    private RegionBinder<TraitDeclRef> traitRef(AnyDeclId traitId) {
        var args = new GenericArgs(List.of(), List.of(store.typeVar(0)), List.of(), List.of(),
                GenericsSource.item(traitId));
        return RegionBinder.empty(new TraitDeclRef(traitId, args));
    }

    /** A trait method with the {@code Self} clause and two extra clauses on {@code Other}. */
    private FunDecl method(int index, String name, Ty localTy) {
        var generics = new GenericParams();
        generics.types.add(new TypeVar(0, "Self"));
        generics.traitClauses.add(new TraitClause(0, Span.DUMMY, PredicateOrigin.TRAIT_SELF, traitRef(TRAIT)));
        generics.traitClauses.add(new TraitClause(1, Span.DUMMY, PredicateOrigin.WHERE_CLAUSE_ON_FN, traitRef(OTHER_TRAIT)));
        generics.traitClauses.add(new TraitClause(2, Span.DUMMY, PredicateOrigin.WHERE_CLAUSE_ON_FN, traitRef(OTHER_TRAIT)));
        var fun = new FunDecl(AnyDeclId.fun(index), meta("test::Trait::" + name), generics,
                new FunSig(false, List.of(), store.unit()), ItemKind.traitDecl(TRAIT, name, true), null);
        Locals locals = new Locals(0);
        locals.newVar(null, store.unit());
        if (localTy != null) {
            locals.newVar(null, localTy);
        }
        Body body = new Body(Span.DUMMY, locals);
        body.newBlock(new BlockData(List.of(), new Terminator.Return(Span.DUMMY)));
        fun.unstructuredBody = body;
        trait.providedMethods.put(name, fun.id);
        crate.addItem(fun);
        return fun;
    }

    private static TraitRef unknown(String tag) {
        return new TraitRef(new TraitRefKind.Unknown(tag), RegionBinder.empty(
                new TraitDeclRef(OTHER_TRAIT, GenericArgs.empty(GenericsSource.item(OTHER_TRAIT)))));
    }

    /** A regular function whose body calls {@code callee} with three witnesses. */
    private FunDecl caller(int index, AnyDeclId callee) {
        var args = new GenericArgs(List.of(), List.of(store.unit()), List.of(),
                List.of(unknown("self"), unknown("first"), unknown("second")), GenericsSource.item(callee));
        Locals locals = new Locals(0);
        locals.newVar(null, store.unit());
        Body body = new Body(Span.DUMMY, locals);
        var call = new Call(FnOperand.regular(FnPtr.regular(callee, args)), List.of(), Place.local(0));
        body.newBlock(new BlockData(List.of(), new Terminator.CallTerm(Span.DUMMY, call, 1)));
        body.newBlock(new BlockData(List.of(), new Terminator.Return(Span.DUMMY)));
        var fun = new FunDecl(AnyDeclId.fun(index), meta("test::caller"), new GenericParams(),
                new FunSig(false, List.of(), store.unit()), ItemKind.REGULAR, null);
        fun.unstructuredBody = body;
        crate.addItem(fun);
        return fun;
    }

    private static List<TraitRef> calleeWitnesses(FunDecl caller) {
        var term = (Terminator.CallTerm) caller.unstructuredBody.block(0).terminator;
        return term.call.func.regular.generics.traitRefs;
    }

    @Test
    public void testUnusedSelfClauseIsPruned() {
        FunDecl m = method(0, "m", null);
        FunDecl c = caller(1, m.id);

        new RemoveUnusedSelfClause().transformCrate(ctx);

        assertEquals(2, m.generics.traitClauses.size());
        assertEquals(0, m.generics.traitClauses.get(0).clauseId);
        assertEquals(1, m.generics.traitClauses.get(1).clauseId);
        assertEquals(PredicateOrigin.WHERE_CLAUSE_ON_FN, m.generics.traitClauses.get(0).origin);
        assertEquals(List.of(unknown("first"), unknown("second")), calleeWitnesses(c));
    }

    @Test
    public void testClauseReferencesAreShifted() {
        // The body mentions clause 2 only, through an associated type.
        Ty projected = store.intern(new TyKind.TraitType(
                new TraitRef(new TraitRefKind.Clause(2), traitRef(OTHER_TRAIT)), "Item"));
        FunDecl m = method(0, "m", projected);

        new RemoveUnusedSelfClause().transformCrate(ctx);

        var localTy = (TyKind.TraitType) m.unstructuredBody.locals.vars.get(1).ty.kind();
        assertEquals(new TraitRefKind.Clause(1), localTy.traitRef.kind);
        assertEquals(2, m.generics.traitClauses.size());
    }

    @Test
    public void testUsedSelfClauseIsKept() {
        Ty projected = store.intern(new TyKind.TraitType(
                new TraitRef(new TraitRefKind.Clause(0), traitRef(TRAIT)), "Item"));
        FunDecl m = method(0, "m", projected);
        FunDecl c = caller(1, m.id);

        new RemoveUnusedSelfClause().transformCrate(ctx);

        assertEquals(3, m.generics.traitClauses.size());
        assertEquals(PredicateOrigin.TRAIT_SELF, m.generics.findClause(0).origin);
        assertEquals(3, calleeWitnesses(c).size());
    }

    @Test
    public void testOpaqueMethodKeepsSelfClause() {
        FunDecl m = method(0, "m", null);
        m.makeOpaque();
        FunDecl c = caller(1, m.id);

        new RemoveUnusedSelfClause().transformCrate(ctx);

        assertEquals(3, m.generics.traitClauses.size());
        assertEquals(3, calleeWitnesses(c).size());
    }

    @Test
    public void testAssociatedConstInitializerAndGlobalArePruned() {
        FunDecl init = new FunDecl(AnyDeclId.fun(0), meta("test::Trait::C::{init}"), selfGenerics(),
                new FunSig(false, List.of(), store.unit()), ItemKind.traitDecl(TRAIT, "C", true), AnyDeclId.global(0));
        Locals locals = new Locals(0);
        locals.newVar(null, store.unit());
        init.unstructuredBody = new Body(Span.DUMMY, locals);
        init.unstructuredBody.newBlock(new BlockData(List.of(), new Terminator.Return(Span.DUMMY)));
        crate.addItem(init);
        GlobalDecl global = new GlobalDecl(AnyDeclId.global(0), meta("test::Trait::C"), selfGenerics(), store.unit(),
                ItemKind.traitDecl(TRAIT, "C", true), init.id);
        crate.addItem(global);
        trait.constDefaults.put("C", global.id);

        new RemoveUnusedSelfClause().transformCrate(ctx);

        assertTrue(init.generics.traitClauses.isEmpty());
        assertTrue(global.generics.traitClauses.isEmpty());
    }

    private GenericParams selfGenerics() {
        var generics = new GenericParams();
        generics.types.add(new TypeVar(0, "Self"));
        generics.traitClauses.add(new TraitClause(0, Span.DUMMY, PredicateOrigin.TRAIT_SELF, traitRef(TRAIT)));
        return generics;
    }
}
