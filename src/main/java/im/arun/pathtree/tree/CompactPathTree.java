package im.arun.pathtree.tree;

import im.arun.pathtree.error.CorruptBufferException;
import im.arun.pathtree.model.PathToken;
import im.arun.pathtree.util.PathComponents;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.RandomAccess;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A compact immutable representation of a tree of paths.
 *
 * <p>The tree is a single flat sequence of tokens. Each name token is one item whose full path
 * is every component still open at that point; each ascend token closes the most recently
 * opened component. Consecutive items therefore share their common ancestry for free.
 *
 * <p>Items can only be streamed, in the depth-first order in which they were inserted.
 * Instances are safe to share between threads; every iterator keeps its own state.
 */
public final class CompactPathTree implements Iterable<List<String>> {
    private static final CompactPathTree EMPTY = new CompactPathTree(new String[0], 0);

    // null slots are ascend tokens
    private final String[] components;
    private final int itemCount;

    CompactPathTree(String[] components, int itemCount) {
        this.components = components;
        this.itemCount = itemCount;
    }

    public static CompactPathTree empty() {
        return EMPTY;
    }

    /**
     * Read-only view of the token sequence.
     */
    public List<PathToken> tokens() {
        return new TokenView();
    }

    public int tokenCount() {
        return components.length;
    }

    /**
     * Number of items, equal to the number of name tokens.
     */
    public int itemCount() {
        return itemCount;
    }

    public int ascendCount() {
        return components.length - itemCount;
    }

    public boolean isEmpty() {
        return itemCount == 0;
    }

    /**
     * A fresh single-pass iterator over the full path of every item.
     * The paths are emitted in a depth-first traversal of the tree, with parents
     * being emitted before children.
     */
    @Override
    public CompactPathTreeIterator iterator() {
        return new CompactPathTreeIterator(this);
    }

    public Stream<List<String>> stream() {
        return StreamSupport.stream(
            Spliterators.spliterator(iterator(), itemCount,
                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
            false);
    }

    public String encode() {
        return encode(PathComponents.DEFAULT_SEPARATOR);
    }

    /**
     * Render the token sequence as one string, e.g. {@code outer/a/../b/c}.
     * Ascend tokens are written as {@code ..}.
     *
     * @throws im.arun.pathtree.error.InvalidComponentException if a component contains the separator
     * @throws IllegalArgumentException if the separator is '.'
     */
    public String encode(char separator) {
        PathComponents.requireValidSeparator(separator);
        StringBuilder encoded = new StringBuilder();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                encoded.append(separator);
            }
            encoded.append(components[i] == null
                ? PathComponents.ASCEND
                : PathComponents.requireValid(components[i], separator));
        }
        return encoded.toString();
    }

    public static CompactPathTree decode(String encoded) {
        return decode(encoded, PathComponents.DEFAULT_SEPARATOR);
    }

    /**
     * Parse the output of {@link #encode(char)}.
     *
     * @throws im.arun.pathtree.error.InvalidComponentException if a segment is not a valid component
     * @throws CorruptBufferException if an ascend would close more components than are open
     * @throws IllegalArgumentException if the separator is '.'
     */
    public static CompactPathTree decode(String encoded, char separator) {
        PathComponents.requireValidSeparator(separator);
        if (encoded == null || encoded.isEmpty()) {
            return EMPTY;
        }

        List<String> components = new ArrayList<>();
        int names = 0;
        int depth = 0;
        int start = 0;
        while (start <= encoded.length()) {
            int end = encoded.indexOf(separator, start);
            if (end < 0) {
                end = encoded.length();
            }
            String segment = encoded.substring(start, end);
            if (PathComponents.ASCEND.equals(segment)) {
                if (depth == 0) {
                    throw new CorruptBufferException(components.size());
                }
                depth--;
                components.add(null);
            } else {
                components.add(PathComponents.requireValid(segment, separator));
                depth++;
                names++;
            }
            start = end + 1;
        }
        return new CompactPathTree(components.toArray(new String[0]), names);
    }

    String componentAt(int position) {
        return components[position];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompactPathTree)) {
            return false;
        }
        return Arrays.equals(components, ((CompactPathTree) o).components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return "CompactPathTree{items=" + itemCount + ", tokens=" + components.length + "}";
    }

    private final class TokenView extends AbstractList<PathToken> implements RandomAccess {
        @Override
        public PathToken get(int index) {
            return PathToken.fromStored(components[index]);
        }

        @Override
        public int size() {
            return components.length;
        }
    }
}
