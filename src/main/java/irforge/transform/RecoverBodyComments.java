package irforge.transform;

import irforge.base.llbc.Body;
import irforge.base.llbc.Statement;
import irforge.base.meta.SourceComment;
import irforge.base.meta.Span;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches the source comments of a body to its statements. A comment goes to the statement that
 * starts earliest on the comment's line (the largest one among those starting at the same column).
 * Comments on lines where no statement starts are dropped.
 */
public class RecoverBodyComments implements Pass.LlbcPass {

    @Override
    public String name() {
        return "recover_body_comments";
    }

    @Override
    public void transformBody(TransformCtx ctx, Body body) {
        if (body.comments.isEmpty()) {
            return;
        }
        Map<Integer, Span> bestSpanForLine = new HashMap<>();
        body.body.forEachStatement(st -> {
            if (st instanceof Statement.FakeRead || st.span == Span.DUMMY) {
                return;
            }
            Span span = st.span;
            bestSpanForLine.merge(span.begLine, span, (best, candidate) -> {
                if (candidate.begCol < best.begCol
                        || (candidate.begCol == best.begCol && candidate.endsAfter(best))) {
                    return candidate;
                }
                return best;
            });
        });

        Map<Integer, List<String>> commentsPerLine = new HashMap<>();
        for (SourceComment comment : body.comments) {
            commentsPerLine.computeIfAbsent(comment.line, l -> new ArrayList<>()).add(comment.text);
        }
        body.body.forEachStatement(st -> {
            Span best = bestSpanForLine.get(st.span.begLine);
            if (best != null && best.equals(st.span) && !(st instanceof Statement.FakeRead)) {
                List<String> comments = commentsPerLine.remove(st.span.begLine);
                if (comments != null) {
                    st.comments.addAll(comments);
                }
            }
        });
    }
}
