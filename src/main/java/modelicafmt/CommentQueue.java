package modelicafmt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.antlr.v4.runtime.Token;

/**
 * Comments collected from the hidden channel, waiting to be written in front
 * of the ordinary token that follows them in the source.
 */
public class CommentQueue {

    private final Deque<Token> pending = new ArrayDeque<>();

    public CommentQueue(List<? extends Token> comments) {
        int lastIndex = -1;
        for (Token comment : comments) {
            if (!TokenKind.of(comment).isComment()) {
                throw new IllegalStateException(String.format(
                    "Token '%s' at line %d:%d is not a comment",
                    comment.getText(), comment.getLine(), comment.getCharPositionInLine()));
            }
            if (comment.getTokenIndex() <= lastIndex) {
                throw new IllegalStateException(String.format(
                    "Comment at index %d is out of order (previous %d)", comment.getTokenIndex(), lastIndex));
            }
            lastIndex = comment.getTokenIndex();
            pending.addLast(comment);
        }
    }

    /**
     * Removes and returns, in source order, the comments that sit between the
     * previously written token and the token about to be written.
     */
    public List<Token> drainBefore(int tokenIndex, int previousTokenIndex) {
        List<Token> drained = new ArrayList<>();
        while (!pending.isEmpty()
                && pending.peekFirst().getTokenIndex() < tokenIndex
                && pending.peekFirst().getTokenIndex() > previousTokenIndex) {
            drained.add(pending.pollFirst());
        }
        return drained;
    }

    /** Removes and returns everything still pending. */
    public List<Token> drainAll() {
        List<Token> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
