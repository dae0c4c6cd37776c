package modelicafmt;

import java.io.Writer;
import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Writes a formatted copy of a Modelica parse tree while it is walked.
 *
 * Layout is decided on rule entry and exit, tokens are written as terminals are
 * visited, and comments from the hidden channel are put back in front of the
 * first token that follows them. One instance formats exactly one tree.
 */
public class ModelicaFormatter extends ModelicaBaseListener {

    private final OutputCursor cursor;
    private final CommentQueue comments;
    private final RuleContextCounters counters = new RuleContextCounters();
    private final boolean alwaysIndentParens;

    public ModelicaFormatter(Writer out, List<? extends Token> commentTokens, boolean alwaysIndentParens) {
        this.cursor = new OutputCursor(out);
        this.comments = new CommentQueue(commentTokens);
        this.alwaysIndentParens = alwaysIndentParens;
    }

    public ModelicaFormatter(Writer out, List<? extends Token> commentTokens, FormatterConfiguration config) {
        this(out, commentTokens, config.isAlwaysIndentParens());
    }

    @Override
    public void visitTerminal(TerminalNode node) {
        Token token = node.getSymbol();
        if (token.getType() == Token.EOF) {
            // nothing left to write but the comments after the last token
            for (Token comment : comments.drainAll()) {
                cursor.writeComment(comment);
            }
            cursor.newlineIfNeeded();
            return;
        }

        // if there's a comment that should go before this node, insert it first
        for (Token comment : comments.drainBefore(token.getTokenIndex(), cursor.getPreviousTokenIndex())) {
            cursor.writeComment(comment);
        }

        cursor.writeToken(token.getText(), token.getTokenIndex());
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
        RuleKind kind = RuleKind.of(ctx);
        if (LayoutRules.forcesNewlineBefore(kind)) {
            cursor.newlineIfNeeded();
        }

        if (LayoutRules.forcesIndentBefore(kind, counters, alwaysIndentParens)) {
            cursor.newlineIfNeeded();
            cursor.maybeIndent();
        }
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        if (LayoutRules.forcesIndentBefore(RuleKind.of(ctx), counters, alwaysIndentParens)) {
            cursor.maybeDedent();
        }
    }

    @Override
    public void enterAnnotation(ModelicaParser.AnnotationContext ctx) {
        counters.enter(RuleKind.ANNOTATION);
    }

    @Override
    public void exitAnnotation(ModelicaParser.AnnotationContext ctx) {
        counters.exit(RuleKind.ANNOTATION);
    }

    @Override
    public void enterNamed_argument(ModelicaParser.Named_argumentContext ctx) {
        counters.enter(RuleKind.NAMED_ARGUMENT);
    }

    @Override
    public void exitNamed_argument(ModelicaParser.Named_argumentContext ctx) {
        counters.exit(RuleKind.NAMED_ARGUMENT);
    }

    @Override
    public void enterVector(ModelicaParser.VectorContext ctx) {
        counters.enter(RuleKind.VECTOR);
    }

    @Override
    public void exitVector(ModelicaParser.VectorContext ctx) {
        counters.exit(RuleKind.VECTOR);
    }

    /**
     * Completes the run: checks that every indentation was undone and flushes
     * the output once.
     *
     * @throws IllegalStateException if the walk left the indentation unbalanced
     */
    public void close() {
        if (!cursor.getIndentation().isEmpty()) {
            throw new IllegalStateException(
                "Indentation stack not empty after walk: " + cursor.getIndentation().size() + " entries");
        }
        cursor.flush();
    }

    OutputCursor getCursor() {
        return cursor;
    }

    RuleContextCounters getCounters() {
        return counters;
    }
}
