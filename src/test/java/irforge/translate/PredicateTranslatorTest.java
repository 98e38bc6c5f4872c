package irforge.translate;

import irforge.base.meta.Span;
import irforge.base.types.*;
import irforge.config.TranslateOptions;
import irforge.errors.ErrorCtx;
import irforge.errors.TranslationError;
import irforge.frontend.*;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class PredicateTranslatorTest {
    private static final Span SPAN = Span.line("lib.rs", 4, 1, 20);
    private static final DefId TRAIT1 = new DefId("test", "Trait1", DefId.Kind.TRAIT);
    private static final DefId TRAIT2 = new DefId("test", "Trait2", DefId.Kind.TRAIT);
    private static final DefId TRAIT3 = new DefId("test", "Trait3", DefId.Kind.TRAIT);

    @Mock
    private FrontendOracle oracle;

    private TranslateOptions options;
    private ErrorCtx errorCtx;
    private TranslateCtx t;
    private ItemTransCtx ctx;

    @BeforeEach
    public void setUp() {
        Logging.init();
        when(oracle.crateName()).thenReturn("test");
        options = new TranslateOptions();
    }

    private void newItem(boolean continueOnFailure) {
        errorCtx = new ErrorCtx(continueOnFailure);
        t = new TranslateCtx(oracle, options, errorCtx);
        var def = new DefId("test", "f", DefId.Kind.FN);
        ctx = new ItemTransCtx(t, t.registerId(SPAN, def), def);
        ctx.pushTypeParam("T");
    }

    private static FrontBinder<FrontTraitRef> traitOnT(DefId trait) {
        return FrontBinder.dummy(new FrontTraitRef(trait, FrontGenericArgs.types(FrontTy.param(0, "T"))));
    }

    private static FrontClause traitClause(DefId trait) {
        return new FrontClause(FrontBinder.dummy(new FrontPredicate.Trait(traitOnT(trait).value)), SPAN);
    }

    @Test
    public void testParentThenItemClausePath() {
        newItem(false);
        // T: Trait1 reached through local clause 2, then its supertrait Trait2 (parent clause 0),
        // then clause 0 on the associated type AssocName of Trait2.
        var path = List.<ImplExprPathChunk>of(
                new ImplExprPathChunk.Parent(traitOnT(TRAIT2), 0),
                new ImplExprPathChunk.AssocItem("AssocName", FrontGenericArgs.EMPTY, traitOnT(TRAIT3), 0));
        var witness = new ImplExpr(traitOnT(TRAIT3), new ImplExprAtom.LocalBound(traitOnT(TRAIT1), 2, path));

        TraitRef ref = ctx.predicates.translateTraitImplExpr(SPAN, witness);

        AnyDeclId trait1 = t.registerId(SPAN, TRAIT1);
        AnyDeclId trait2 = t.registerId(SPAN, TRAIT2);
        var expected = new TraitRefKind.ItemClause(
                new TraitRefKind.ParentClause(new TraitRefKind.Clause(2), trait1, 0), trait2, "AssocName", 0);
        assertEquals(expected, ref.kind);
        assertEquals(t.registerId(SPAN, TRAIT3), ref.traitDeclRef.skipBinder.traitId);
    }

    @Test
    public void testSelfRootedPath() {
        newItem(false);
        var path = List.<ImplExprPathChunk>of(new ImplExprPathChunk.Parent(traitOnT(TRAIT2), 1));
        var witness = new ImplExpr(traitOnT(TRAIT2), new ImplExprAtom.SelfImpl(traitOnT(TRAIT1), path));

        TraitRef ref = ctx.predicates.translateTraitImplExpr(SPAN, witness);

        assertEquals(new TraitRefKind.ParentClause(TraitRefKind.SelfId.INSTANCE, t.registerId(SPAN, TRAIT1), 1), ref.kind);
    }

    @Test
    public void testErrorWitnessBecomesUnknownWhenRecovering() {
        newItem(true);
        var witness = new ImplExpr(traitOnT(TRAIT1), new ImplExprAtom.Error("no impl found"));

        TraitRef ref = ctx.predicates.translateTraitImplExpr(SPAN, witness);

        var unknown = assertInstanceOf(TraitRefKind.Unknown.class, ref.kind);
        assertTrue(unknown.message.startsWith("Error during trait resolution"));
        assertEquals(1, errorCtx.errorCount());
        assertEquals(TranslationError.Kind.RESOLUTION_FAILURE, errorCtx.getDiagnostics().get(0).getKind());
    }

    @Test
    public void testErrorWitnessAbortsWithoutRecovery() {
        newItem(false);
        var witness = new ImplExpr(traitOnT(TRAIT1), new ImplExprAtom.Error("no impl found"));

        var err = assertThrows(TranslationError.class, () -> ctx.predicates.translateTraitImplExpr(SPAN, witness));
        assertEquals(TranslationError.Kind.RESOLUTION_FAILURE, err.kind);
    }

    @Test
    public void testErrorWitnessToleratedAndReportedWhenConfigured() {
        options.errorOnImplExprError = false;
        newItem(false);
        var witness = new ImplExpr(traitOnT(TRAIT1), new ImplExprAtom.Error("no impl found"));

        TraitRef ref = ctx.predicates.translateTraitImplExpr(SPAN, witness);

        assertEquals(new TraitRefKind.Unknown("no impl found"), ref.kind);
        // reported, but the item still translates
        assertEquals(1, errorCtx.errorCount());
        var diagnostic = errorCtx.getDiagnostics().get(0);
        assertEquals(TranslationError.Kind.RESOLUTION_FAILURE, diagnostic.getKind());
        assertEquals("no impl found", diagnostic.getMessage());
    }

    @Test
    public void testAssocItemWithArgumentsIsUnsupported() {
        newItem(true);
        var path = List.<ImplExprPathChunk>of(new ImplExprPathChunk.AssocItem("Gat",
                FrontGenericArgs.types(FrontTy.BOOL), traitOnT(TRAIT2), 0));
        var witness = new ImplExpr(traitOnT(TRAIT2), new ImplExprAtom.LocalBound(traitOnT(TRAIT1), 0, path));

        TraitRef ref = ctx.predicates.translateTraitImplExpr(SPAN, witness);

        assertInstanceOf(TraitRefKind.Unknown.class, ref.kind);
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, errorCtx.getDiagnostics().get(0).getKind());
    }

    @Test
    public void testTraitPredicatesAreNumberedFirst() {
        newItem(true);
        var outlives = new FrontClause(FrontBinder.dummy(
                new FrontPredicate.TypeOutlives(FrontTy.param(0, "T"), FrontRegion.STATIC)), SPAN);
        var unsupported = new FrontClause(FrontBinder.dummy(new FrontPredicate.Unsupported("well-formed")),
                Span.line("lib.rs", 5, 1, 3));
        var preds = List.of(outlives, traitClause(TRAIT1), unsupported, traitClause(TRAIT2));

        ctx.predicates.registerPredicates(preds, PredicateOrigin.WHERE_CLAUSE_ON_FN, PredicateLocation.base(ctx));

        var clauses = ctx.generics.traitClauses;
        assertEquals(2, clauses.size());
        assertEquals(0, clauses.get(0).clauseId);
        assertEquals(t.registerId(SPAN, TRAIT1), clauses.get(0).trait.skipBinder.traitId);
        assertEquals(1, clauses.get(1).clauseId);
        assertEquals(t.registerId(SPAN, TRAIT2), clauses.get(1).trait.skipBinder.traitId);
        assertEquals(1, ctx.generics.typesOutlive.size());
        // the unsupported predicate is reported and skipped
        assertEquals(1, errorCtx.errorCount());
    }

    @Test
    public void testItemClausesAreNumberedPerLocation() {
        newItem(false);
        List<TraitClause> assocClauses = new ArrayList<>();

        ctx.predicates.registerPredicates(List.of(traitClause(TRAIT1)), PredicateOrigin.WHERE_CLAUSE_ON_FN,
                PredicateLocation.base(ctx));
        ctx.predicates.registerPredicates(List.of(traitClause(TRAIT2), traitClause(TRAIT3)),
                PredicateOrigin.traitItem("Assoc"), PredicateLocation.item("Assoc", assocClauses));

        assertEquals(1, ctx.generics.traitClauses.size());
        assertEquals(2, assocClauses.size());
        assertEquals(0, assocClauses.get(0).clauseId);
        assertEquals(1, assocClauses.get(1).clauseId);
        assertEquals(PredicateOrigin.traitItem("Assoc"), assocClauses.get(1).origin);
    }
}
