package modelicafmt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Set;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.VocabularyImpl;
import org.junit.jupiter.api.Test;

class TokenKindTests {

    @Test
    void testClassifiesCommentTypes() {
        assertEquals(TokenKind.BLOCK_COMMENT, TokenKind.of(ModelicaLexer.COMMENT));
        assertEquals(TokenKind.LINE_COMMENT, TokenKind.of(ModelicaLexer.LINE_COMMENT));
        assertEquals(TokenKind.ORDINARY, TokenKind.of(ModelicaLexer.IDENT));
        assertEquals(TokenKind.ORDINARY, TokenKind.of(ModelicaLexer.STRING));
        assertEquals(TokenKind.ORDINARY, TokenKind.of(Token.EOF));
    }

    @Test
    void testIsComment() {
        assertTrue(TokenKind.BLOCK_COMMENT.isComment());
        assertTrue(TokenKind.LINE_COMMENT.isComment());
        assertFalse(TokenKind.ORDINARY.isComment());
    }

    @Test
    void testGeneratedVocabularyMatches() {
        TokenKind.verifyVocabulary(ModelicaLexer.VOCABULARY);
    }

    @Test
    void testMismatchedVocabularyFails() {
        String[] symbolicNames = new String[ModelicaLexer.LINE_COMMENT + 1];
        symbolicNames[ModelicaLexer.COMMENT] = "LINE_COMMENT";
        symbolicNames[ModelicaLexer.LINE_COMMENT] = "COMMENT";
        VocabularyImpl swapped = new VocabularyImpl(new String[0], symbolicNames);
        assertThrows(IllegalStateException.class, () -> TokenKind.verifyVocabulary(swapped));
    }

    @Test
    void testEveryFormattingRuleIsMapped() {
        Set<RuleKind> mapped = EnumSet.noneOf(RuleKind.class);
        for (int i = 0; i < ModelicaParser.ruleNames.length; i++) {
            mapped.add(RuleKind.of(i));
        }
        assertEquals(EnumSet.allOf(RuleKind.class), mapped);
    }

    @Test
    void testRuleKindOfContext() {
        assertEquals(RuleKind.COMPOSITION, RuleKind.of(new ModelicaParser.CompositionContext(null, 0)));
        assertEquals(RuleKind.NAMED_ARGUMENT, RuleKind.of(new ModelicaParser.Named_argumentContext(null, 0)));
        assertEquals(RuleKind.OTHER, RuleKind.of(new ModelicaParser.PrimaryContext(null, 0)));
    }
}
