package irforge.frontend;

import irforge.base.meta.SourceComment;
import irforge.base.meta.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A front-end body: locals (0 is the return place, then the arguments) and basic blocks indexed
 * by position, block 0 being the entry.
 */
public class FrontBody {
    public static class LocalDecl {
        public final String name;
        public final FrontTy ty;

        public LocalDecl(String name, FrontTy ty) {
            this.name = name;
            this.ty = ty;
        }
    }

    public static class BasicBlock {
        public final List<FrontStatement> statements;
        public final FrontTerminator terminator;

        public BasicBlock(List<FrontStatement> statements, FrontTerminator terminator) {
            this.statements = List.copyOf(statements);
            this.terminator = terminator;
        }
    }

    public final Span span;
    public final int argCount;
    public final List<LocalDecl> locals = new ArrayList<>();
    public final List<BasicBlock> blocks = new ArrayList<>();
    public final List<SourceComment> comments = new ArrayList<>();

    public FrontBody(Span span, int argCount) {
        this.span = span;
        this.argCount = argCount;
    }
}
