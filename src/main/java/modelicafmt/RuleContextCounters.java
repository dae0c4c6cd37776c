package modelicafmt;

/**
 * Nesting depth of the rules that change how call arguments are laid out.
 * Rules can be recursive, so each one is a counter rather than a flag.
 */
public class RuleContextCounters {

    private int annotation = 0;
    private int namedArgument = 0;
    private int vector = 0;

    public void enter(RuleKind kind) {
        switch (kind) {
            case ANNOTATION:
                annotation++;
                break;
            case NAMED_ARGUMENT:
                namedArgument++;
                break;
            case VECTOR:
                vector++;
                break;
            default:
                break;
        }
    }

    public void exit(RuleKind kind) {
        switch (kind) {
            case ANNOTATION:
                annotation = decrement(annotation, kind);
                break;
            case NAMED_ARGUMENT:
                namedArgument = decrement(namedArgument, kind);
                break;
            case VECTOR:
                vector = decrement(vector, kind);
                break;
            default:
                break;
        }
    }

    private static int decrement(int depth, RuleKind kind) {
        if (depth == 0) {
            throw new IllegalStateException("Exit of " + kind + " without a matching enter");
        }
        return depth - 1;
    }

    public boolean inAnnotation() { return annotation > 0; }
    public boolean inNamedArgument() { return namedArgument > 0; }
    public boolean inVector() { return vector > 0; }

    public int annotationDepth() { return annotation; }
    public int namedArgumentDepth() { return namedArgument; }
    public int vectorDepth() { return vector; }

    @Override
    public String toString() {
        return String.format("RuleContextCounters{annotation=%d, namedArgument=%d, vector=%d}",
                             annotation, namedArgument, vector);
    }
}
