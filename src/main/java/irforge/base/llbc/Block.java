package irforge.base.llbc;

import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A sequence of structured statements.
 */
public class Block {
    public final List<Statement> statements;

    public Block() {
        this.statements = new ArrayList<>();
    }

    public Block(List<Statement> statements) {
        this.statements = new ArrayList<>(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /** Pre-order walk over every statement, including the nested ones. */
    public void forEachStatement(Consumer<Statement> f) {
        for (Statement st : statements) {
            f.accept(st);
            st.childBlocks().forEach(b -> b.forEachStatement(f));
        }
    }

    public void foldTypes(TypeFolder folder) {
        statements.replaceAll(s -> s.foldTypes(folder));
    }

    public void visitTypes(TypeVisitor visitor) {
        statements.forEach(s -> s.visitTypes(visitor));
    }

    void print(StringBuilder sb, String indent) {
        for (Statement st : statements) {
            st.print(sb, indent);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, "");
        return sb.toString();
    }
}
