package modelicafmt;

/**
 * Decides, per rule kind, whether entering a rule starts a new line and
 * whether it increases the indentation.
 */
public final class LayoutRules {

    private LayoutRules() {
    }

    /**
     * Returns true if the rule should start on a new line.
     */
    public static boolean forcesNewlineBefore(RuleKind kind) {
        return switch (kind) {
            case COMPOSITION,
                 EQUATIONS,
                 IF_EXPRESSION_CONDITION,
                 ELSEIF_EXPRESSION_CONDITION,
                 ELSE_EXPRESSION_CONDITION -> true;
            case ELEMENT,
                 ALGORITHM_STATEMENTS,
                 CONTROL_STRUCTURE_BODY,
                 STRING_COMMENT,
                 ANNOTATION,
                 EXPRESSION_LIST,
                 CONSTRAINING_CLAUSE,
                 IF_EXPRESSION,
                 IF_EXPRESSION_BODY,
                 ARGUMENT,
                 NAMED_ARGUMENT,
                 FUNCTION_ARGUMENT,
                 VECTOR,
                 OTHER -> false;
        };
    }

    /**
     * Returns true if the rule should be on a new line and indented.
     * Call arguments are only indented when {@code alwaysIndentParens} is set,
     * and never inside an annotation. Function arguments are also left alone
     * inside named arguments and vectors so they are not indented twice.
     */
    public static boolean forcesIndentBefore(RuleKind kind, RuleContextCounters counters, boolean alwaysIndentParens) {
        return switch (kind) {
            case ELEMENT,
                 EQUATIONS,
                 ALGORITHM_STATEMENTS,
                 CONTROL_STRUCTURE_BODY,
                 STRING_COMMENT,
                 ANNOTATION,
                 EXPRESSION_LIST,
                 CONSTRAINING_CLAUSE,
                 IF_EXPRESSION,
                 IF_EXPRESSION_BODY -> true;
            case ARGUMENT,
                 NAMED_ARGUMENT -> alwaysIndentParens && !counters.inAnnotation();
            case FUNCTION_ARGUMENT -> alwaysIndentParens
                && !counters.inNamedArgument()
                && !counters.inVector()
                && !counters.inAnnotation();
            case COMPOSITION,
                 IF_EXPRESSION_CONDITION,
                 ELSEIF_EXPRESSION_CONDITION,
                 ELSE_EXPRESSION_CONDITION,
                 VECTOR,
                 OTHER -> false;
        };
    }
}
