package im.arun.pathtree.util;

import im.arun.pathtree.error.InvalidComponentException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rules and helpers for individual path components.
 * A component is one segment of a path: non-empty, never "." or "..", and free of the separator.
 */
public final class PathComponents {

    /** Reserved component standing for "go up one level". */
    public static final String ASCEND = "..";

    /** Reserved component standing for "this level"; never stored. */
    public static final String CURRENT = ".";

    public static final char DEFAULT_SEPARATOR = '/';

    private PathComponents() {}

    /**
     * Validate a separator, returning it unchanged. '.' is rejected because the ascend marker
     * is spelled with it.
     *
     * @throws IllegalArgumentException if the separator cannot delimit components
     */
    public static char requireValidSeparator(char separator) {
        if (separator == '.') {
            throw new IllegalArgumentException("'.' cannot be used as a separator");
        }
        return separator;
    }

    public static String requireValid(String component) {
        return requireValid(component, DEFAULT_SEPARATOR);
    }

    /**
     * Validate a component, returning it unchanged.
     *
     * @throws InvalidComponentException if the component cannot be stored
     */
    public static String requireValid(String component, char separator) {
        if (component == null) {
            throw new InvalidComponentException(null, "component is null");
        }
        if (component.isEmpty()) {
            throw new InvalidComponentException(component, "component is empty");
        }
        if (ASCEND.equals(component) || CURRENT.equals(component)) {
            throw new InvalidComponentException(component, "component is reserved");
        }
        if (component.indexOf(separator) >= 0) {
            throw new InvalidComponentException(component,
                String.format("component contains the separator '%c'", separator));
        }
        return component;
    }

    public static boolean isValid(String component, char separator) {
        return component != null
            && !component.isEmpty()
            && !ASCEND.equals(component)
            && !CURRENT.equals(component)
            && component.indexOf(separator) < 0;
    }

    /**
     * Number of leading components the two paths share.
     */
    public static int commonPrefixLength(List<String> a, List<String> b) {
        int limit = Math.min(a.size(), b.size());
        int i = 0;
        while (i < limit && a.get(i).equals(b.get(i))) {
            i++;
        }
        return i;
    }

    /**
     * Join components into a single string, e.g. [outer, b, c] -> "outer/b/c".
     */
    public static String join(List<String> path, char separator) {
        StringBuilder joined = new StringBuilder();
        for (String component : path) {
            if (joined.length() > 0) {
                joined.append(separator);
            }
            joined.append(component);
        }
        return joined.toString();
    }

    /**
     * Split a joined path into validated components. Empty segments produced by leading,
     * trailing or doubled separators are dropped; "." and ".." are rejected.
     */
    public static List<String> split(String path, char separator) {
        List<String> components = new ArrayList<>();
        if (path == null || path.isEmpty()) {
            return components;
        }

        int start = 0;
        while (start <= path.length()) {
            int end = path.indexOf(separator, start);
            if (end < 0) {
                end = path.length();
            }
            if (end > start) {
                components.add(requireValid(path.substring(start, end), separator));
            }
            start = end + 1;
        }
        return components;
    }
}
