package irforge.transform;

import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.expressions.ProjectionElem;
import irforge.base.expressions.Rvalue;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces overflow-checked arithmetic by the plain operator, whose semantics is to panic on
 * overflow:
 * <pre>
 *   tmp = checked.+(a, b);
 *   assert(move tmp.1 == false);
 *   dst = move tmp.0;
 * </pre>
 * becomes {@code dst = a + b}. Runs after asserts are turned into statements and goto chains
 * are merged, so that the three statements sit in the same block.
 */
public class RemoveArithmeticOverflowChecks implements Pass.UllbcPass {

    @Override
    public String name() {
        return "remove_arithmetic_overflow_checks";
    }

    @Override
    public void transformBody(TransformCtx ctx, Body body) {
        for (BlockData block : body.blocks.values()) {
            List<Statement> statements = block.statements;
            if (statements.size() < 3) {
                continue;
            }
            List<Statement> out = new ArrayList<>(statements.size());
            int i = 0;
            while (i < statements.size()) {
                Statement rewritten = i + 2 < statements.size()
                        ? rewrite(statements.get(i), statements.get(i + 1), statements.get(i + 2))
                        : null;
                if (rewritten != null) {
                    out.add(rewritten);
                    i += 3;
                } else {
                    out.add(statements.get(i));
                    i++;
                }
            }
            if (out.size() != statements.size()) {
                statements.clear();
                statements.addAll(out);
            }
        }
    }

    private static Statement rewrite(Statement first, Statement second, Statement third) {
        if (!(first instanceof Statement.Assign checked)
                || !(checked.rvalue instanceof Rvalue.BinaryOp op) || !op.op.isChecked()
                || !checked.place.isLocal()) {
            return null;
        }
        Place result = checked.place;
        if (!(second instanceof Statement.Assert check) || check.expected
                || !readsField(check.cond, result, 1)) {
            return null;
        }
        if (!(third instanceof Statement.Assign use) || !(use.rvalue instanceof Rvalue.Use u)
                || !readsField(u.operand, result, 0)) {
            return null;
        }
        return new Statement.Assign(checked.span, use.place, new Rvalue.BinaryOp(op.op.unchecked(), op.left, op.right));
    }

    private static boolean readsField(Operand operand, Place base, int field) {
        if (operand instanceof Operand.Const) {
            return false;
        }
        return operand.place().equals(base.project(ProjectionElem.field(field)));
    }
}
