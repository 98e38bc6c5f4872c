package irforge.base.meta;

import java.util.Objects;

/**
 * A source location range. Lines and columns are 1-based.
 */
public class Span {
    public static final Span DUMMY = new Span("<unknown>", 0, 0, 0, 0);

    public final String file;
    public final int begLine;
    public final int begCol;
    public final int endLine;
    public final int endCol;

    public Span(String file, int begLine, int begCol, int endLine, int endCol) {
        this.file = file;
        this.begLine = begLine;
        this.begCol = begCol;
        this.endLine = endLine;
        this.endCol = endCol;
    }

    public static Span line(String file, int line, int begCol, int endCol) {
        return new Span(file, line, begCol, line, endCol);
    }

    /** True if this span ends strictly after {@code other}. */
    public boolean endsAfter(Span other) {
        if (endLine != other.endLine) {
            return endLine > other.endLine;
        }
        return endCol > other.endCol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Span span = (Span) o;
        return begLine == span.begLine && begCol == span.begCol
                && endLine == span.endLine && endCol == span.endCol
                && file.equals(span.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, begLine, begCol, endLine, endCol);
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d-%d:%d", file, begLine, begCol, endLine, endCol);
    }
}
