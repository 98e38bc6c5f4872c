package irforge.base.meta;

/**
 * A line comment found in the source of a body.
 */
public class SourceComment {
    public final int line;
    public final String text;

    public SourceComment(int line, String text) {
        this.line = line;
        this.text = text;
    }

    @Override
    public String toString() {
        return line + ": " + text;
    }
}
