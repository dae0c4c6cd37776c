package modelicafmt;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * The parser rules the formatter reacts to. Every other rule is {@link #OTHER}.
 */
public enum RuleKind {
    COMPOSITION,
    ELEMENT,
    EQUATIONS,
    ALGORITHM_STATEMENTS,
    CONTROL_STRUCTURE_BODY,
    STRING_COMMENT,
    ANNOTATION,
    EXPRESSION_LIST,
    CONSTRAINING_CLAUSE,
    IF_EXPRESSION,
    IF_EXPRESSION_BODY,
    IF_EXPRESSION_CONDITION,
    ELSEIF_EXPRESSION_CONDITION,
    ELSE_EXPRESSION_CONDITION,
    ARGUMENT,
    NAMED_ARGUMENT,
    FUNCTION_ARGUMENT,
    VECTOR,
    OTHER;

    public static RuleKind of(ParserRuleContext ctx) {
        return of(ctx.getRuleIndex());
    }

    public static RuleKind of(int ruleIndex) {
        switch (ruleIndex) {
            case ModelicaParser.RULE_composition:
                return COMPOSITION;
            case ModelicaParser.RULE_element:
                return ELEMENT;
            case ModelicaParser.RULE_equations:
                return EQUATIONS;
            case ModelicaParser.RULE_algorithm_statements:
                return ALGORITHM_STATEMENTS;
            case ModelicaParser.RULE_control_structure_body:
                return CONTROL_STRUCTURE_BODY;
            case ModelicaParser.RULE_string_comment:
                return STRING_COMMENT;
            case ModelicaParser.RULE_annotation:
                return ANNOTATION;
            case ModelicaParser.RULE_expression_list:
                return EXPRESSION_LIST;
            case ModelicaParser.RULE_constraining_clause:
                return CONSTRAINING_CLAUSE;
            case ModelicaParser.RULE_if_expression:
                return IF_EXPRESSION;
            case ModelicaParser.RULE_if_expression_body:
                return IF_EXPRESSION_BODY;
            case ModelicaParser.RULE_if_expression_condition:
                return IF_EXPRESSION_CONDITION;
            case ModelicaParser.RULE_elseif_expression_condition:
                return ELSEIF_EXPRESSION_CONDITION;
            case ModelicaParser.RULE_else_expression_condition:
                return ELSE_EXPRESSION_CONDITION;
            case ModelicaParser.RULE_argument:
                return ARGUMENT;
            case ModelicaParser.RULE_named_argument:
                return NAMED_ARGUMENT;
            case ModelicaParser.RULE_function_argument:
                return FUNCTION_ARGUMENT;
            case ModelicaParser.RULE_vector:
                return VECTOR;
            default:
                return OTHER;
        }
    }
}
