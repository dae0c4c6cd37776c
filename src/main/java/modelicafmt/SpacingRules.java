package modelicafmt;

import java.util.Set;

/**
 * Decides whether two adjacent tokens on the same line are separated by a space.
 */
public final class SpacingRules {

    // tokens which should generally not have a space after them
    static final Set<String> NO_SPACE_AFTER = Set.of(
        "(", "=", ".", "[", "{", "-", "^", "*", "/", ";"
    );

    // tokens which should generally not have a space before them
    static final Set<String> NO_SPACE_BEFORE = Set.of(
        "(", ")", "[", "]", "}", ";", "=", ",", ".", "-", "^", "*", "/"
    );

    private SpacingRules() {
    }

    /**
     * Returns true if a space should be written between {@code previousText}
     * and {@code currentText}.
     */
    public static boolean insertSpaceBefore(String currentText, String previousText) {
        // annotation(...) is the one call-like construct that keeps its space
        if ("(".equals(currentText) && "annotation".equals(previousText)) {
            return true;
        }
        return !NO_SPACE_AFTER.contains(previousText) && !NO_SPACE_BEFORE.contains(currentText);
    }
}
