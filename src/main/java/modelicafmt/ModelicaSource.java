package modelicafmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * One parsed Modelica unit: the parse tree, the ordinary tokens the parser
 * consumed and, separately, the comment tokens it never saw.
 */
public final class ModelicaSource {

    private final String sourceName;
    private final ModelicaParser.Stored_definitionContext tree;
    private final List<Token> ordinaryTokens;
    private final List<Token> commentTokens;

    private ModelicaSource(String sourceName, ModelicaParser.Stored_definitionContext tree,
                           List<Token> ordinaryTokens, List<Token> commentTokens) {
        this.sourceName = sourceName;
        this.tree = tree;
        this.ordinaryTokens = Collections.unmodifiableList(ordinaryTokens);
        this.commentTokens = Collections.unmodifiableList(commentTokens);
    }

    /**
     * Lexes and parses {@code source}. The first lexical or syntax error aborts.
     *
     * @throws ModelicaSyntaxException if the source is not valid Modelica
     */
    public static ModelicaSource parse(String source, String sourceName) {
        CharStream input = CharStreams.fromString(source, sourceName);
        ModelicaLexer lexer = new ModelicaLexer(input);

        // quick runtime check for comment token types
        TokenKind.verifyVocabulary(lexer.getVocabulary());

        StrictErrorListener errorListener = new StrictErrorListener();
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        List<Token> ordinary = new ArrayList<>();
        List<Token> comments = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (TokenKind.of(token).isComment()) {
                comments.add(token);
            } else if (token.getChannel() == Token.DEFAULT_CHANNEL) {
                ordinary.add(token);
            }
        }

        ModelicaParser parser = new ModelicaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ModelicaParser.Stored_definitionContext tree = parser.stored_definition();
        return new ModelicaSource(sourceName, tree, ordinary, comments);
    }

    public String getSourceName() { return sourceName; }
    public ModelicaParser.Stored_definitionContext getTree() { return tree; }

    /** Ordinary tokens in source order, the end-of-file token included. */
    public List<Token> getOrdinaryTokens() { return ordinaryTokens; }

    /** Block and line comments in source order. */
    public List<Token> getCommentTokens() { return commentTokens; }

    private static class StrictErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            String sourceName = recognizer.getInputStream() != null
                ? recognizer.getInputStream().getSourceName()
                : "<unknown>";
            throw new ModelicaSyntaxException(sourceName, line, charPositionInLine, msg);
        }
    }
}
