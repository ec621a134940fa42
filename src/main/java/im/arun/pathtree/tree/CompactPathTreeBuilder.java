package im.arun.pathtree.tree;

import im.arun.pathtree.error.NotDepthFirstException;
import im.arun.pathtree.error.UnbalancedLeaveException;
import im.arun.pathtree.util.PathComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulates a depth-first traversal into a {@link CompactPathTree}.
 *
 * <p>Two equivalent ways of feeding it:
 * <ul>
 *   <li>events: {@link #enter(String)}, {@link #leaf(String)} and {@link #leave()}, as produced
 *       by walking a directory;</li>
 *   <li>full paths: {@link #addPath(List)}, for listings already in depth-first pre-order.
 *       Only the ascends and new components relative to the previous item are stored.</li>
 * </ul>
 * {@link #finish()} hands the tokens over to an immutable tree. Not thread-safe.
 */
public class CompactPathTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CompactPathTreeBuilder.class);

    private enum State {
        OPEN,
        HALTED,
        FINISHED
    }

    private final char separator;
    // null entries are ascend tokens
    private final List<String> tokens = new ArrayList<>();
    private final List<String> stack = new ArrayList<>();
    // childrenEmitted.get(d): names already opened below stack[0..d), used to spot reopened subtrees.
    // Null until the first addPath call; streaming construction never needs it.
    private List<Set<String>> childrenEmitted;
    private int itemCount;
    private int pathsAdded;
    private State state = State.OPEN;

    public CompactPathTreeBuilder() {
        this(PathComponents.DEFAULT_SEPARATOR);
    }

    /**
     * @throws IllegalArgumentException if the separator is '.'
     */
    public CompactPathTreeBuilder(char separator) {
        this.separator = PathComponents.requireValidSeparator(separator);
    }

    /**
     * Build a tree from full paths given in depth-first pre-order.
     */
    public static CompactPathTree fromPaths(Iterable<? extends List<String>> paths) {
        CompactPathTreeBuilder builder = new CompactPathTreeBuilder();
        for (List<String> path : paths) {
            builder.addPath(path);
        }
        return builder.finish();
    }

    /**
     * Open a component: it becomes an item and the parent of everything entered before the
     * matching {@link #leave()}.
     *
     * @throws im.arun.pathtree.error.InvalidComponentException if the name cannot be stored
     */
    public CompactPathTreeBuilder enter(String name) {
        ensureOpen();
        push(PathComponents.requireValid(name, separator));
        return this;
    }

    /**
     * An item without children: {@code enter(name)} immediately followed by {@code leave()}.
     */
    public CompactPathTreeBuilder leaf(String name) {
        enter(name);
        return leave();
    }

    /**
     * Close the most recently entered component.
     *
     * @throws UnbalancedLeaveException if nothing is open
     */
    public CompactPathTreeBuilder leave() {
        ensureOpen();
        if (stack.isEmpty()) {
            throw new UnbalancedLeaveException();
        }
        pop();
        return this;
    }

    /**
     * Append the item at {@code path}, ascending to the longest prefix it shares with the
     * currently open path and descending through the remaining components. Every component
     * past the shared prefix becomes an item of its own.
     *
     * <p>Any {@link NotDepthFirstException} halts the builder; further calls fail.
     *
     * @throws NotDepthFirstException if the path is empty, was already emitted, is an ancestor
     *                                of the open path, or reopens a subtree already closed
     * @throws im.arun.pathtree.error.InvalidComponentException if a component cannot be stored
     */
    public CompactPathTreeBuilder addPath(List<String> path) {
        ensureOpen();
        Objects.requireNonNull(path, "path");
        int index = pathsAdded;

        if (path.isEmpty()) {
            throw halt(index, path, "path is empty");
        }
        for (String component : path) {
            PathComponents.requireValid(component, separator);
        }

        if (childrenEmitted == null) {
            startTrackingChildren();
        }
        int common = PathComponents.commonPrefixLength(stack, path);
        if (common == path.size()) {
            throw halt(index, path, "path was already emitted as the previous item or one of its ancestors");
        }
        String firstNew = path.get(common);
        if (childrenEmitted.get(common).contains(firstNew)) {
            throw halt(index, path,
                String.format("'%s' was already emitted and closed under the same parent", firstNew));
        }

        while (stack.size() > common) {
            pop();
        }
        for (int i = common; i < path.size(); i++) {
            push(path.get(i));
        }
        pathsAdded++;
        return this;
    }

    /**
     * Number of currently open components.
     */
    public int depth() {
        return stack.size();
    }

    /**
     * Freeze the accumulated tokens. Components still open are left open; no trailing
     * ascends are added. The builder cannot be used afterwards.
     */
    public CompactPathTree finish() {
        ensureOpen();
        state = State.FINISHED;

        CompactPathTree tree = tokens.isEmpty()
            ? CompactPathTree.empty()
            : new CompactPathTree(tokens.toArray(new String[0]), itemCount);
        logger.debug("Finished tree with {} items, {} ascends, {} still open",
            tree.itemCount(), tree.ascendCount(), stack.size());

        tokens.clear();
        stack.clear();
        childrenEmitted = null;
        return tree;
    }

    // siblings closed before tracking started are not known; only the open path is seeded
    private void startTrackingChildren() {
        childrenEmitted = new ArrayList<>(stack.size() + 1);
        for (String open : stack) {
            Set<String> siblings = new HashSet<>();
            siblings.add(open);
            childrenEmitted.add(siblings);
        }
        childrenEmitted.add(new HashSet<>());
    }

    private void push(String name) {
        if (childrenEmitted != null) {
            childrenEmitted.get(stack.size()).add(name);
            childrenEmitted.add(new HashSet<>());
        }
        tokens.add(name);
        stack.add(name);
        itemCount++;
    }

    private void pop() {
        tokens.add(null);
        stack.remove(stack.size() - 1);
        if (childrenEmitted != null) {
            childrenEmitted.remove(childrenEmitted.size() - 1);
        }
    }

    private NotDepthFirstException halt(int index, List<String> path, String reason) {
        state = State.HALTED;
        return new NotDepthFirstException(index, List.copyOf(path), reason);
    }

    private void ensureOpen() {
        if (state == State.FINISHED) {
            throw new IllegalStateException("Builder already finished");
        }
        if (state == State.HALTED) {
            throw new IllegalStateException("Builder halted after rejecting out-of-order input");
        }
    }
}
