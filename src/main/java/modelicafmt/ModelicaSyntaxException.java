package modelicafmt;

/**
 * Thrown when the source cannot be lexed or parsed. Nothing is formatted.
 */
public class ModelicaSyntaxException extends RuntimeException {

    private final String sourceName;
    private final int line;
    private final int charPositionInLine;

    public ModelicaSyntaxException(String sourceName, int line, int charPositionInLine, String message) {
        super(String.format("%s line %d:%d %s", sourceName, line, charPositionInLine, message));
        this.sourceName = sourceName;
        this.line = line;
        this.charPositionInLine = charPositionInLine;
    }

    public String getSourceName() { return sourceName; }
    public int getLine() { return line; }
    public int getCharPositionInLine() { return charPositionInLine; }
}
