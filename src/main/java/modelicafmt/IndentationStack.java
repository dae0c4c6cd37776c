package modelicafmt;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks rendered and ignored indentations of the rules currently entered.
 * Only rendered entries count towards the indentation of the next line.
 */
public class IndentationStack {

    public enum Indent {
        RENDERED,
        SUPPRESSED
    }

    private final Deque<Indent> entries = new ArrayDeque<>();
    private int rendered = 0;

    /**
     * Pushes an entry for a rule that wants to be indented. The entry is only
     * rendered if the current line has not been indented yet, which keeps the
     * indentation to at most one increase per line when several nested rules
     * start on the same line.
     *
     * @return the entry that was pushed
     */
    public Indent push(boolean lineIndentIncreased) {
        Indent indent = lineIndentIncreased ? Indent.SUPPRESSED : Indent.RENDERED;
        entries.push(indent);
        if (indent == Indent.RENDERED) {
            rendered++;
        }
        return indent;
    }

    public Indent pop() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Indentation stack underflow");
        }
        Indent indent = entries.pop();
        if (indent == Indent.RENDERED) {
            rendered--;
        }
        return indent;
    }

    /** Number of rendered indentations. */
    public int depth() {
        return rendered;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
