package modelicafmt;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

import org.antlr.v4.runtime.Token;

/**
 * Write position of a formatting run: every piece of text goes through here so
 * that indentation, spaces and newlines are decided in one place.
 */
public class OutputCursor {

    static final String INDENT = "  ";
    static final String NEWLINE = "\n";
    static final String STATEMENT_TERMINATOR = ";";

    private final BufferedWriter writer;
    private final IndentationStack indentation = new IndentationStack();

    // true when the write position follows a newline character
    private boolean onNewLine = true;
    // true when the indentation has already been increased for the current line
    private boolean lineIndentIncreased = false;
    private String previousTokenText = "";
    private int previousTokenIndex = -1;

    public OutputCursor(Writer out) {
        this.writer = out instanceof BufferedWriter ? (BufferedWriter) out : new BufferedWriter(out);
    }

    public void writeNewline() {
        write(NEWLINE);
        onNewLine = true;
        lineIndentIncreased = false;
    }

    /**
     * Writes whatever has to precede {@code text}: the indentation when at the
     * start of a line, otherwise a single space if the spacing rules ask for one.
     */
    public void writeSpaceBefore(String text) {
        if (onNewLine) {
            int depth = indentation.depth();
            if (depth > 0) {
                write(INDENT.repeat(depth));
            }
            onNewLine = false;
        } else if (SpacingRules.insertSpaceBefore(text, previousTokenText)) {
            write(" ");
        }
    }

    /**
     * Writes an ordinary token and remembers it as the previous token.
     */
    public void writeToken(String text, int tokenIndex) {
        writeSpaceBefore(text);
        write(text);
        if (STATEMENT_TERMINATOR.equals(text)) {
            writeNewline();
        }
        previousTokenText = text;
        previousTokenIndex = tokenIndex;
    }

    /**
     * Writes a comment. A line comment always ends the line; a block comment
     * does not. Comments are never remembered as the previous token.
     */
    public void writeComment(Token comment) {
        TokenKind kind = TokenKind.of(comment);
        if (!kind.isComment()) {
            throw new IllegalStateException("Not a comment token: " + comment);
        }
        if (!onNewLine && previousTokenText.endsWith("/")) {
            // "/" followed by "/*" or "//" would lex as a different comment
            write(" ");
        } else {
            writeSpaceBefore(comment.getText());
        }
        write(comment.getText());
        if (kind == TokenKind.LINE_COMMENT) {
            writeNewline();
        }
    }

    public void newlineIfNeeded() {
        if (!onNewLine) {
            writeNewline();
        }
    }

    public void maybeIndent() {
        IndentationStack.Indent pushed = indentation.push(lineIndentIncreased);
        if (pushed == IndentationStack.Indent.RENDERED) {
            lineIndentIncreased = true;
        }
    }

    public void maybeDedent() {
        indentation.pop();
    }

    public void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush formatted output", e);
        }
    }

    private void write(String text) {
        try {
            writer.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write formatted output", e);
        }
    }

    public boolean isOnNewLine() { return onNewLine; }
    public boolean isLineIndentIncreased() { return lineIndentIncreased; }
    public String getPreviousTokenText() { return previousTokenText; }
    public int getPreviousTokenIndex() { return previousTokenIndex; }
    public IndentationStack getIndentation() { return indentation; }
}
