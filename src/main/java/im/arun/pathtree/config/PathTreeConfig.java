package im.arun.pathtree.config;

import im.arun.pathtree.util.PathComponents;
import lombok.Data;

@Data
public class PathTreeConfig {
    private String separator = "/";
    private boolean followLinks = false;
    private boolean skipHidden = false;
    private boolean failOnAccessDenied = false;

    /**
     * The separator as a single character.
     *
     * @throws IllegalArgumentException if the configured separator is not exactly one character,
     *                                  or is '.'
     */
    public char separatorChar() {
        if (separator == null || separator.length() != 1) {
            throw new IllegalArgumentException("Separator must be a single character, got: " + separator);
        }
        return PathComponents.requireValidSeparator(separator.charAt(0));
    }
}
