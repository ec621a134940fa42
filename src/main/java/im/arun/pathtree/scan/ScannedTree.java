package im.arun.pathtree.scan;

import im.arun.pathtree.tree.CompactPathTree;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * A compact tree together with the directory it was scanned from.
 * The root itself is not an item; every item path is relative to it.
 */
@Getter
@AllArgsConstructor
public class ScannedTree {
    private final Path root;
    private final CompactPathTree tree;

    /**
     * Every item resolved against the root, in depth-first order.
     */
    public Stream<Path> paths() {
        return tree.stream().map(this::resolve);
    }

    public int itemCount() {
        return tree.itemCount();
    }

    private Path resolve(List<String> components) {
        Path path = root;
        for (String component : components) {
            path = path.resolve(component);
        }
        return path;
    }
}
