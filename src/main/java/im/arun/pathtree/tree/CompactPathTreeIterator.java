package im.arun.pathtree.tree;

import im.arun.pathtree.error.CorruptBufferException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Replays the tokens of a {@link CompactPathTree}, reconstructing the full path of each item.
 *
 * <p>Single pass and not thread-safe. Create a new iterator from the tree to start over.
 */
public final class CompactPathTreeIterator implements Iterator<List<String>> {
    private final CompactPathTree tree;
    private final List<String> stack = new ArrayList<>();
    private int position;
    // true once position rests on the next name token or the end
    private boolean positioned;

    CompactPathTreeIterator(CompactPathTree tree) {
        this.tree = tree;
    }

    @Override
    public boolean hasNext() {
        if (!positioned) {
            skipAscends();
        }
        return position < tree.tokenCount();
    }

    /**
     * Full path of the next item, root first. The returned list is immutable.
     *
     * @throws CorruptBufferException if the tree closes more components than it opened
     */
    @Override
    public List<String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        stack.add(tree.componentAt(position++));
        positioned = false;
        return List.copyOf(stack);
    }

    /**
     * Number of components currently on the path stack. {@link #hasNext()} may lower it
     * by consuming the ascends that precede the next item.
     */
    public int depth() {
        return stack.size();
    }

    private void skipAscends() {
        int end = tree.tokenCount();
        while (position < end && tree.componentAt(position) == null) {
            if (stack.isEmpty()) {
                throw new CorruptBufferException(position);
            }
            stack.remove(stack.size() - 1);
            position++;
        }
        positioned = true;
    }
}
