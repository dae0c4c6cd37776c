package modelicafmt;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;

/**
 * Category of a lexer token as far as the formatter is concerned.
 * Comments live on the hidden channel and are re-inserted by the formatter,
 * everything else is written where the parse tree puts it.
 */
public enum TokenKind {
    ORDINARY,
    BLOCK_COMMENT,
    LINE_COMMENT;

    public static TokenKind of(Token token) {
        return of(token.getType());
    }

    public static TokenKind of(int tokenType) {
        if (tokenType == ModelicaLexer.COMMENT) {
            return BLOCK_COMMENT;
        }
        if (tokenType == ModelicaLexer.LINE_COMMENT) {
            return LINE_COMMENT;
        }
        return ORDINARY;
    }

    public boolean isComment() {
        return this != ORDINARY;
    }

    /**
     * Checks that the comment token types used above still carry the expected
     * symbolic names in the given vocabulary.
     *
     * @throws IllegalStateException if the grammar and the classifier disagree
     */
    public static void verifyVocabulary(Vocabulary vocabulary) {
        String comment = vocabulary.getSymbolicName(ModelicaLexer.COMMENT);
        String lineComment = vocabulary.getSymbolicName(ModelicaLexer.LINE_COMMENT);
        if (!"COMMENT".equals(comment) || !"LINE_COMMENT".equals(lineComment)) {
            throw new IllegalStateException(String.format(
                "Comment or line comment token types do not match (got %s, %s)", comment, lineComment));
        }
    }
}
