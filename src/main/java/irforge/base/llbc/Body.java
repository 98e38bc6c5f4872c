package irforge.base.llbc;

import irforge.base.expressions.Locals;
import irforge.base.meta.SourceComment;
import irforge.base.meta.Span;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A structured body: a tree of statements with labeled loops and regions, and no block ids.
 */
public class Body {
    public final Span span;
    public final Locals locals;
    public final Block body;
    public final List<SourceComment> comments = new ArrayList<>();

    public Body(Span span, Locals locals, Block body) {
        this.span = span == null ? Span.DUMMY : span;
        this.locals = locals;
        this.body = body;
    }

    public void foldTypes(TypeFolder folder) {
        locals.foldTypes(folder);
        body.foldTypes(folder);
    }

    public void visitTypes(TypeVisitor visitor) {
        locals.visitTypes(visitor);
        body.visitTypes(visitor);
    }

    @Override
    public String toString() {
        return body.toString();
    }
}
