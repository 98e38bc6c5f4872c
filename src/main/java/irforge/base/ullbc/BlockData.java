package irforge.base.ullbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class BlockData {
    public final List<Statement> statements;
    public Terminator terminator;

    public BlockData(List<Statement> statements, Terminator terminator) {
        this.statements = new ArrayList<>(statements);
        this.terminator = Objects.requireNonNull(terminator);
    }

    public boolean isGoto() {
        return terminator instanceof Terminator.Goto;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        statements.forEach(s -> sb.append("  ").append(s).append(";\n"));
        return sb.append("  ").append(terminator).toString();
    }
}
