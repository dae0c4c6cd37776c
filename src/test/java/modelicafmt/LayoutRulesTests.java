package modelicafmt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

class LayoutRulesTests {

    private static final Set<RuleKind> NEWLINE_KINDS = EnumSet.of(
            RuleKind.COMPOSITION,
            RuleKind.EQUATIONS,
            RuleKind.IF_EXPRESSION_CONDITION,
            RuleKind.ELSEIF_EXPRESSION_CONDITION,
            RuleKind.ELSE_EXPRESSION_CONDITION);

    private static final Set<RuleKind> INDENT_KINDS = EnumSet.of(
            RuleKind.ELEMENT,
            RuleKind.EQUATIONS,
            RuleKind.ALGORITHM_STATEMENTS,
            RuleKind.CONTROL_STRUCTURE_BODY,
            RuleKind.STRING_COMMENT,
            RuleKind.ANNOTATION,
            RuleKind.EXPRESSION_LIST,
            RuleKind.CONSTRAINING_CLAUSE,
            RuleKind.IF_EXPRESSION,
            RuleKind.IF_EXPRESSION_BODY);

    @Test
    void testNewlineKinds() {
        for (RuleKind kind : RuleKind.values()) {
            assertEquals(NEWLINE_KINDS.contains(kind), LayoutRules.forcesNewlineBefore(kind), kind.name());
        }
    }

    @Test
    void testIndentKindsWithDefaultSettings() {
        RuleContextCounters counters = new RuleContextCounters();
        for (RuleKind kind : RuleKind.values()) {
            assertEquals(INDENT_KINDS.contains(kind), LayoutRules.forcesIndentBefore(kind, counters, false), kind.name());
        }
    }

    @Test
    void testArgumentsIndentedOnlyWhenEnabled() {
        RuleContextCounters counters = new RuleContextCounters();
        assertFalse(LayoutRules.forcesIndentBefore(RuleKind.ARGUMENT, counters, false));
        assertTrue(LayoutRules.forcesIndentBefore(RuleKind.ARGUMENT, counters, true));
        assertTrue(LayoutRules.forcesIndentBefore(RuleKind.NAMED_ARGUMENT, counters, true));
        assertTrue(LayoutRules.forcesIndentBefore(RuleKind.FUNCTION_ARGUMENT, counters, true));
    }

    @Test
    void testNoArgumentIndentInsideAnnotation() {
        RuleContextCounters counters = new RuleContextCounters();
        counters.enter(RuleKind.ANNOTATION);
        assertFalse(LayoutRules.forcesIndentBefore(RuleKind.ARGUMENT, counters, true));
        assertFalse(LayoutRules.forcesIndentBefore(RuleKind.NAMED_ARGUMENT, counters, true));
        assertFalse(LayoutRules.forcesIndentBefore(RuleKind.FUNCTION_ARGUMENT, counters, true));
        // the annotation itself is always indented
        assertTrue(LayoutRules.forcesIndentBefore(RuleKind.ANNOTATION, counters, true));
    }

    @Test
    void testFunctionArgumentNotIndentedInsideNamedArgumentOrVector() {
        RuleContextCounters counters = new RuleContextCounters();
        counters.enter(RuleKind.NAMED_ARGUMENT);
        assertFalse(LayoutRules.forcesIndentBefore(RuleKind.FUNCTION_ARGUMENT, counters, true));
        // a named argument nested in a named argument is still indented
        assertTrue(LayoutRules.forcesIndentBefore(RuleKind.NAMED_ARGUMENT, counters, true));
        counters.exit(RuleKind.NAMED_ARGUMENT);

        counters.enter(RuleKind.VECTOR);
        assertFalse(LayoutRules.forcesIndentBefore(RuleKind.FUNCTION_ARGUMENT, counters, true));
        assertTrue(LayoutRules.forcesIndentBefore(RuleKind.ARGUMENT, counters, true));
        counters.exit(RuleKind.VECTOR);

        assertTrue(LayoutRules.forcesIndentBefore(RuleKind.FUNCTION_ARGUMENT, counters, true));
    }

    @Test
    void testCountersTrackRecursiveNesting() {
        RuleContextCounters counters = new RuleContextCounters();
        counters.enter(RuleKind.VECTOR);
        counters.enter(RuleKind.VECTOR);
        counters.exit(RuleKind.VECTOR);
        assertTrue(counters.inVector());
        counters.exit(RuleKind.VECTOR);
        assertFalse(counters.inVector());
        assertEquals(0, counters.vectorDepth());
    }

    @Test
    void testCountersIgnoreOtherKinds() {
        RuleContextCounters counters = new RuleContextCounters();
        counters.enter(RuleKind.ELEMENT);
        counters.exit(RuleKind.ELEMENT);
        assertEquals(0, counters.annotationDepth());
        assertEquals(0, counters.namedArgumentDepth());
        assertEquals(0, counters.vectorDepth());
    }

    @Test
    void testUnbalancedExitFails() {
        RuleContextCounters counters = new RuleContextCounters();
        assertThrows(IllegalStateException.class, () -> counters.exit(RuleKind.ANNOTATION));
    }
}
