package irforge.translate;

import irforge.base.expressions.*;
import irforge.base.meta.Span;
import irforge.base.types.*;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Statement;
import irforge.base.ullbc.SwitchTargets;
import irforge.base.ullbc.Terminator;
import irforge.errors.TranslationError;
import irforge.frontend.*;
import irforge.utils.Logging;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the unstructured body of a function from the front end's basic blocks.
 * Block {@code i} of the front-end body keeps id {@code i}; blocks added while building get the
 * following ids.
 */
public class BodyBuilder {
    private final ItemTransCtx ctx;
    private final FrontBody front;
    private Body body;

    public BodyBuilder(ItemTransCtx ctx, FrontBody front) {
        this.ctx = ctx;
        this.front = front;
    }

    public Body build() {
        Span span = front.span;
        if (front.blocks.isEmpty()) {
            throw ctx.error(span, TranslationError.Kind.MALFORMED_GRAPH, "Body has no blocks");
        }
        Locals locals = new Locals(front.argCount);
        for (FrontBody.LocalDecl decl : front.locals) {
            locals.newVar(decl.name, ctx.translateTy(span, decl.ty));
        }
        if (locals.size() <= front.argCount) {
            throw ctx.error(span, TranslationError.Kind.MALFORMED_GRAPH, String.format(
                    "Body declares %d locals but has %d arguments", locals.size(), front.argCount));
        }
        body = new Body(span, locals);
        body.comments.addAll(front.comments);

        for (int i = 0; i < front.blocks.size(); i++) {
            body.reserveBlockId();
        }
        for (int i = 0; i < front.blocks.size(); i++) {
            body.setBlock(i, translateBlock(front.blocks.get(i)));
        }
        try {
            body.validate();
        } catch (TranslationError e) {
            throw ctx.error(span, e.kind, e.getMessage());
        }
        Logging.trace("BodyBuilder", String.format("%s: %d blocks, %d locals", ctx.def, body.blocks.size(),
                locals.size()));
        return body;
    }

    private BlockData translateBlock(FrontBody.BasicBlock block) {
        List<Statement> statements = new ArrayList<>();
        for (FrontStatement st : block.statements) {
            Statement translated = translateStatement(st);
            if (translated != null) {
                statements.add(translated);
            }
        }
        return new BlockData(statements, translateTerminator(block.terminator));
    }

    /** Returns null for statements with no counterpart. */
    private Statement translateStatement(FrontStatement st) {
        Span span = st.span;
        if (st instanceof FrontStatement.Assign assign) {
            checkPlace(span, assign.place);
            return new Statement.Assign(span, assign.place, translateRvalue(span, assign.rvalue));
        } else if (st instanceof FrontStatement.FakeRead read) {
            checkPlace(span, read.place);
            return new Statement.FakeRead(span, read.place);
        } else if (st instanceof FrontStatement.SetDiscriminant set) {
            checkPlace(span, set.place);
            return new Statement.SetDiscriminant(span, set.place, set.variant);
        } else if (st instanceof FrontStatement.StorageLive) {
            return null;
        } else if (st instanceof FrontStatement.StorageDead dead) {
            checkLocal(span, dead.local);
            return new Statement.StorageDead(span, dead.local);
        } else if (st instanceof FrontStatement.Deinit deinit) {
            checkPlace(span, deinit.place);
            return new Statement.Deinit(span, deinit.place);
        } else if (st instanceof FrontStatement.Nop) {
            return new Statement.Nop(span);
        }
        throw new IllegalStateException("Unhandled statement " + st.getClass().getSimpleName());
    }

    private Terminator translateTerminator(FrontTerminator term) {
        Span span = term.span;
        if (term instanceof FrontTerminator.Goto g) {
            return new Terminator.Goto(span, g.target);
        } else if (term instanceof FrontTerminator.SwitchInt sw) {
            return translateSwitch(sw);
        } else if (term instanceof FrontTerminator.Call call) {
            checkPlace(span, call.dest);
            List<Operand> args = new ArrayList<>();
            call.args.forEach(a -> args.add(translateOperand(span, a)));
            Call translated = new Call(translateFnOperand(span, call.func), args, call.dest);
            int target;
            if (call.target == null) {
                // The callee never returns.
                target = body.newBlock(new BlockData(List.of(), new Terminator.Unreachable(span)));
            } else {
                target = call.target;
            }
            return new Terminator.CallTerm(span, translated, target);
        } else if (term instanceof FrontTerminator.Drop drop) {
            checkPlace(span, drop.place);
            return new Terminator.Drop(span, drop.place, drop.target);
        } else if (term instanceof FrontTerminator.Assert a) {
            return new Terminator.Assert(span, translateOperand(span, a.cond), a.expected, a.target);
        } else if (term instanceof FrontTerminator.Return) {
            return new Terminator.Return(span);
        } else if (term instanceof FrontTerminator.Abort) {
            return new Terminator.Panic(span);
        } else if (term instanceof FrontTerminator.Unreachable) {
            return new Terminator.Unreachable(span);
        }
        throw new IllegalStateException("Unhandled terminator " + term.getClass().getSimpleName());
    }

    private Terminator translateSwitch(FrontTerminator.SwitchInt sw) {
        Span span = sw.span;
        Operand discr = translateOperand(span, sw.discr);
        if (sw.values.size() != sw.targets.size()) {
            throw ctx.error(span, TranslationError.Kind.MALFORMED_GRAPH, "Switch values and targets differ in length");
        }
        if (sw.discrTy instanceof FrontTy.Bool) {
            if (sw.values.size() != 1 || sw.values.get(0).signum() != 0) {
                throw ctx.error(span, TranslationError.Kind.MALFORMED_GRAPH, "Boolean switch must test the value 0");
            }
            return new Terminator.Switch(span, discr, new SwitchTargets.If(sw.otherwise, sw.targets.get(0)));
        } else if (sw.discrTy instanceof FrontTy.Int intTy) {
            List<SwitchTargets.Branch> branches = new ArrayList<>();
            for (int i = 0; i < sw.values.size(); i++) {
                BigInteger value = sw.values.get(i);
                if (!intTy.ty.fits(value)) {
                    throw ctx.error(span, TranslationError.Kind.MALFORMED_GRAPH,
                            String.format("Switch value %s does not fit in %s", value, intTy.ty));
                }
                branches.add(new SwitchTargets.Branch(new ScalarValue(intTy.ty, value), sw.targets.get(i)));
            }
            return new Terminator.Switch(span, discr, new SwitchTargets.SwitchInt(intTy.ty, branches, sw.otherwise));
        }
        throw ctx.error(span, TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                "Switch on a value that is neither a boolean nor an integer");
    }

    private Rvalue translateRvalue(Span span, FrontRvalue rvalue) {
        if (rvalue instanceof FrontRvalue.Use use) {
            return new Rvalue.Use(translateOperand(span, use.operand));
        } else if (rvalue instanceof FrontRvalue.Ref ref) {
            checkPlace(span, ref.place);
            return new Rvalue.Ref(ref.place, ref.mutable ? RefKind.MUT : RefKind.SHARED);
        } else if (rvalue instanceof FrontRvalue.BinaryOp bin) {
            return new Rvalue.BinaryOp(bin.op, translateOperand(span, bin.left), translateOperand(span, bin.right));
        } else if (rvalue instanceof FrontRvalue.UnaryOp un) {
            return new Rvalue.UnaryOp(un.op, translateOperand(span, un.operand));
        } else if (rvalue instanceof FrontRvalue.Discriminant d) {
            checkPlace(span, d.place);
            return new Rvalue.Discriminant(d.place);
        } else if (rvalue instanceof FrontRvalue.Aggregate agg) {
            AggregateKind kind;
            if (agg.adt == null) {
                kind = new AggregateKind(TypeId.TUPLE, null, GenericArgs.empty(GenericsSource.BUILTIN));
            } else {
                AnyDeclId id = ctx.t.registerId(span, agg.adt, AnyDeclId.Kind.TYPE);
                kind = new AggregateKind(TypeId.adt(id), agg.variant,
                        ctx.translateGenericArgs(span, agg.args, GenericsSource.item(id)));
            }
            List<Operand> operands = new ArrayList<>();
            agg.operands.forEach(o -> operands.add(translateOperand(span, o)));
            return new Rvalue.Aggregate(kind, operands);
        }
        throw new IllegalStateException("Unhandled rvalue " + rvalue.getClass().getSimpleName());
    }

    private Operand translateOperand(Span span, FrontOperand operand) {
        if (operand instanceof FrontOperand.Copy copy) {
            checkPlace(span, copy.place);
            return Operand.copy(copy.place);
        } else if (operand instanceof FrontOperand.Move move) {
            checkPlace(span, move.place);
            return Operand.move(move.place);
        } else if (operand instanceof FrontOperand.Const c) {
            return Operand.constant(translateConstant(span, c.value));
        }
        throw new IllegalStateException("Unhandled operand " + operand.getClass().getSimpleName());
    }

    private ConstantExpr translateConstant(Span span, FrontConstant c) {
        Ty ty = ctx.translateTy(span, c.ty);
        if (c instanceof FrontConstant.Lit lit) {
            return new ConstantExpr.Lit(lit.value, ty);
        } else if (c instanceof FrontConstant.Global global) {
            AnyDeclId id = ctx.t.registerId(span, global.id, AnyDeclId.Kind.GLOBAL);
            return new ConstantExpr.Global(id, ctx.translateGenericArgs(span, global.args, GenericsSource.item(id)), ty);
        } else if (c instanceof FrontConstant.FnDef fn) {
            return new ConstantExpr.Fn(translateFnPtr(span, fn), ty);
        }
        throw new IllegalStateException("Unhandled constant " + c.getClass().getSimpleName());
    }

    private FnOperand translateFnOperand(Span span, FrontOperand func) {
        if (func instanceof FrontOperand.Const c) {
            if (c.value instanceof FrontConstant.FnDef fn) {
                return FnOperand.regular(translateFnPtr(span, fn));
            }
            throw ctx.error(span, TranslationError.Kind.UNSUPPORTED_CONSTRUCT, "Call of a constant that is not a function");
        }
        Place place = func instanceof FrontOperand.Copy copy ? copy.place : ((FrontOperand.Move) func).place;
        checkPlace(span, place);
        return FnOperand.dynamic(place);
    }

    /**
     * A function item. For a trait method, the trait witness says which implementation is
     * called, and the arguments are the full arguments of the method as declared in the trait.
     */
    private FnPtr translateFnPtr(Span span, FrontConstant.FnDef fn) {
        AnyDeclId funId = ctx.t.registerId(span, fn.id, AnyDeclId.Kind.FUN);
        GenericArgs generics = ctx.translateGenericArgs(span, fn.args, GenericsSource.item(funId));
        if (fn.traitImpl == null) {
            return FnPtr.regular(funId, generics);
        }
        TraitRef traitRef = ctx.predicates.translateTraitImplExpr(span, fn.traitImpl);
        return new FnPtr(funId, traitRef, fn.id.name(), generics);
    }

    private void checkPlace(Span span, Place place) {
        checkLocal(span, place.local);
    }

    private void checkLocal(Span span, int local) {
        if (local < 0 || local >= body.locals.size()) {
            throw ctx.error(span, TranslationError.Kind.MALFORMED_GRAPH, "Reference to unknown local _" + local);
        }
    }
}
