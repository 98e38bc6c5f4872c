package irforge.base.llbc;

import irforge.base.expressions.Call;
import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.expressions.Rvalue;
import irforge.base.meta.Span;
import irforge.base.types.IntegerTy;
import irforge.base.types.ScalarValue;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A structured statement. Control only leaves a statement through {@link Return},
 * {@link Abort}, or a labeled {@link Break}/{@link Continue} naming an enclosing
 * {@link Loop} or {@link Labeled} region.
 */
public abstract class Statement {
    public final Span span;
    /** Source comments attached to this statement. */
    public final List<String> comments = new ArrayList<>();

    protected Statement(Span span) {
        this.span = span == null ? Span.DUMMY : span;
    }

    public List<Block> childBlocks() {
        return List.of();
    }

    /**
     * Rewrite the types of this statement. Nested blocks are rewritten in place; simple statements
     * are replaced by a copy that keeps the comments.
     */
    public Statement foldTypes(TypeFolder folder) {
        childBlocks().forEach(b -> b.foldTypes(folder));
        return this;
    }

    public void visitTypes(TypeVisitor visitor) {
        childBlocks().forEach(b -> b.visitTypes(visitor));
    }

    protected Statement keepComments(Statement from) {
        comments.addAll(from.comments);
        return this;
    }

    void print(StringBuilder sb, String indent) {
        comments.forEach(c -> sb.append(indent).append("// ").append(c).append('\n'));
        sb.append(indent).append(this).append('\n');
    }

    public static final class Assign extends Statement {
        public final Place place;
        public final Rvalue rvalue;

        public Assign(Span span, Place place, Rvalue rvalue) {
            super(span);
            this.place = Objects.requireNonNull(place);
            this.rvalue = Objects.requireNonNull(rvalue);
        }

        @Override
        public Statement foldTypes(TypeFolder folder) {
            return new Assign(span, place, rvalue.foldTypes(folder)).keepComments(this);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            rvalue.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return place + " := " + rvalue;
        }
    }

    public static final class FakeRead extends Statement {
        public final Place place;

        public FakeRead(Span span, Place place) {
            super(span);
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public String toString() {
            return "@fake_read(" + place + ")";
        }
    }

    public static final class SetDiscriminant extends Statement {
        public final Place place;
        public final int variant;

        public SetDiscriminant(Span span, Place place, int variant) {
            super(span);
            this.place = Objects.requireNonNull(place);
            this.variant = variant;
        }

        @Override
        public String toString() {
            return String.format("@discriminant(%s) := %d", place, variant);
        }
    }

    public static final class StorageDead extends Statement {
        public final int local;

        public StorageDead(Span span, int local) {
            super(span);
            this.local = local;
        }

        @Override
        public String toString() {
            return "@storage_dead(_" + local + ")";
        }
    }

    public static final class Deinit extends Statement {
        public final Place place;

        public Deinit(Span span, Place place) {
            super(span);
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public String toString() {
            return "@deinit(" + place + ")";
        }
    }

    public static final class Drop extends Statement {
        public final Place place;

        public Drop(Span span, Place place) {
            super(span);
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public String toString() {
            return "drop " + place;
        }
    }

    public static final class Assert extends Statement {
        public final Operand cond;
        public final boolean expected;

        public Assert(Span span, Operand cond, boolean expected) {
            super(span);
            this.cond = Objects.requireNonNull(cond);
            this.expected = expected;
        }

        @Override
        public Statement foldTypes(TypeFolder folder) {
            return new Assert(span, cond.foldTypes(folder), expected).keepComments(this);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            cond.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return String.format("assert(%s == %b)", cond, expected);
        }
    }

    public static final class CallStmt extends Statement {
        public final Call call;

        public CallStmt(Span span, Call call) {
            super(span);
            this.call = Objects.requireNonNull(call);
        }

        @Override
        public Statement foldTypes(TypeFolder folder) {
            return new CallStmt(span, call.foldTypes(folder)).keepComments(this);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            call.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return call.toString();
        }
    }

    public static final class Abort extends Statement {
        public Abort(Span span) {
            super(span);
        }

        @Override
        public String toString() {
            return "panic";
        }
    }

    public static final class Return extends Statement {
        public Return(Span span) {
            super(span);
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    /** Exit the enclosing {@link Loop} or {@link Labeled} region carrying {@code label}. */
    public static final class Break extends Statement {
        public final int label;

        public Break(Span span, int label) {
            super(span);
            this.label = label;
        }

        @Override
        public String toString() {
            return "break 'l" + label;
        }
    }

    /** Jump back to the head of the enclosing {@link Loop} carrying {@code label}. */
    public static final class Continue extends Statement {
        public final int label;

        public Continue(Span span, int label) {
            super(span);
            this.label = label;
        }

        @Override
        public String toString() {
            return "continue 'l" + label;
        }
    }

    public static final class Nop extends Statement {
        public Nop(Span span) {
            super(span);
        }

        @Override
        public String toString() {
            return "nop";
        }
    }

    public static final class Unreachable extends Statement {
        public Unreachable(Span span) {
            super(span);
        }

        @Override
        public String toString() {
            return "unreachable";
        }
    }

    public static final class If extends Statement {
        public final Operand cond;
        public final Block thenBlock;
        public final Block elseBlock;

        public If(Span span, Operand cond, Block thenBlock, Block elseBlock) {
            super(span);
            this.cond = Objects.requireNonNull(cond);
            this.thenBlock = Objects.requireNonNull(thenBlock);
            this.elseBlock = Objects.requireNonNull(elseBlock);
        }

        @Override
        public List<Block> childBlocks() {
            return List.of(thenBlock, elseBlock);
        }

        @Override
        public Statement foldTypes(TypeFolder folder) {
            super.foldTypes(folder);
            return new If(span, cond.foldTypes(folder), thenBlock, elseBlock).keepComments(this);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            cond.visitTypes(visitor);
            super.visitTypes(visitor);
        }

        @Override
        void print(StringBuilder sb, String indent) {
            comments.forEach(c -> sb.append(indent).append("// ").append(c).append('\n'));
            sb.append(indent).append("if ").append(cond).append(" {\n");
            thenBlock.print(sb, indent + "  ");
            sb.append(indent).append("} else {\n");
            elseBlock.print(sb, indent + "  ");
            sb.append(indent).append("}\n");
        }

        @Override
        public String toString() {
            return "if " + cond + " { ... }";
        }
    }

    public static final class SwitchBranch {
        public final ScalarValue value;
        public final Block block;

        public SwitchBranch(ScalarValue value, Block block) {
            this.value = Objects.requireNonNull(value);
            this.block = Objects.requireNonNull(block);
        }
    }

    /** Multi-way branch; branches appear in the order of the original terminator. */
    public static final class SwitchInt extends Statement {
        public final Operand discr;
        public final IntegerTy ty;
        public final List<SwitchBranch> branches;
        public final Block otherwise;

        public SwitchInt(Span span, Operand discr, IntegerTy ty, List<SwitchBranch> branches, Block otherwise) {
            super(span);
            this.discr = Objects.requireNonNull(discr);
            this.ty = Objects.requireNonNull(ty);
            this.branches = List.copyOf(branches);
            this.otherwise = Objects.requireNonNull(otherwise);
        }

        @Override
        public List<Block> childBlocks() {
            List<Block> blocks = new ArrayList<>();
            branches.forEach(b -> blocks.add(b.block));
            blocks.add(otherwise);
            return blocks;
        }

        @Override
        public Statement foldTypes(TypeFolder folder) {
            super.foldTypes(folder);
            return new SwitchInt(span, discr.foldTypes(folder), ty, branches, otherwise).keepComments(this);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            discr.visitTypes(visitor);
            super.visitTypes(visitor);
        }

        @Override
        void print(StringBuilder sb, String indent) {
            comments.forEach(c -> sb.append(indent).append("// ").append(c).append('\n'));
            sb.append(indent).append("switch ").append(discr).append(" {\n");
            for (var branch : branches) {
                sb.append(indent).append("  ").append(branch.value).append(" => {\n");
                branch.block.print(sb, indent + "    ");
                sb.append(indent).append("  }\n");
            }
            sb.append(indent).append("  _ => {\n");
            otherwise.print(sb, indent + "    ");
            sb.append(indent).append("  }\n").append(indent).append("}\n");
        }

        @Override
        public String toString() {
            return "switch " + discr + " { ... }";
        }
    }

    public static final class Loop extends Statement {
        public final int label;
        public final Block body;

        public Loop(Span span, int label, Block body) {
            super(span);
            this.label = label;
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public List<Block> childBlocks() {
            return List.of(body);
        }

        @Override
        void print(StringBuilder sb, String indent) {
            comments.forEach(c -> sb.append(indent).append("// ").append(c).append('\n'));
            sb.append(indent).append("'l").append(label).append(": loop {\n");
            body.print(sb, indent + "  ");
            sb.append(indent).append("}\n");
        }

        @Override
        public String toString() {
            return "'l" + label + ": loop { ... }";
        }
    }

    /** A region that a {@link Break} naming its label exits; falling off its end also exits it. */
    public static final class Labeled extends Statement {
        public final int label;
        public final Block body;

        public Labeled(Span span, int label, Block body) {
            super(span);
            this.label = label;
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public List<Block> childBlocks() {
            return List.of(body);
        }

        @Override
        void print(StringBuilder sb, String indent) {
            comments.forEach(c -> sb.append(indent).append("// ").append(c).append('\n'));
            sb.append(indent).append("'l").append(label).append(": {\n");
            body.print(sb, indent + "  ");
            sb.append(indent).append("}\n");
        }

        @Override
        public String toString() {
            return "'l" + label + ": { ... }";
        }
    }
}
