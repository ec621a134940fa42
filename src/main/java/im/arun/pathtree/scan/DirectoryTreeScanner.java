package im.arun.pathtree.scan;

import im.arun.pathtree.config.PathTreeConfig;
import im.arun.pathtree.tree.CompactPathTree;
import im.arun.pathtree.tree.CompactPathTreeBuilder;
import im.arun.pathtree.util.PathComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link CompactPathTree} from a depth-first walk of a directory.
 *
 * <p>Entries are visited in file name order. Symbolic links are stored but not followed
 * unless {@link PathTreeConfig#isFollowLinks()} is set, in which case directory cycles are
 * reported as {@link FileSystemLoopException}.
 */
public class DirectoryTreeScanner {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryTreeScanner.class);
    // used by the default PathVisitor.handleError
    static final Logger visitorLogger = LoggerFactory.getLogger(PathVisitor.class);
    private static final LinkOption[] NO_FOLLOW = {LinkOption.NOFOLLOW_LINKS};
    private static final LinkOption[] FOLLOW = {};

    private final PathTreeConfig config;

    public DirectoryTreeScanner() {
        this(new PathTreeConfig());
    }

    public DirectoryTreeScanner(PathTreeConfig config) {
        this.config = config;
    }

    public ScannedTree scan(Path root) throws IOException {
        return scan(root, new PathVisitor() {});
    }

    /**
     * Walk {@code root} and build its tree. The root itself is not an item.
     *
     * @throws IOException the first error the visitor declared fatal
     */
    public ScannedTree scan(Path root, PathVisitor visitor) throws IOException {
        long start = System.nanoTime();
        CompactPathTreeBuilder builder = new CompactPathTreeBuilder(config.separatorChar());

        Deque<Object> openDirectories = new ArrayDeque<>();
        if (config.isFollowLinks()) {
            openDirectories.push(fileKey(root));
        }
        scanDirectory(builder, root, visitor, openDirectories);
        CompactPathTree tree = builder.finish();

        logger.info("Scanned {} items under {} in {}ms",
            tree.itemCount(), root, (System.nanoTime() - start) / 1_000_000);
        return new ScannedTree(root, tree);
    }

    private void scanDirectory(CompactPathTreeBuilder builder, Path directory, PathVisitor visitor,
                               Deque<Object> openDirectories) throws IOException {
        List<Path> entries;
        try {
            entries = listEntries(directory);
        } catch (IOException e) {
            rethrowIfFatal(visitor.handleError(e, directory, null));
            return;
        }
        logger.debug("Listing {} entries in {}", entries.size(), directory);

        for (Path entry : entries) {
            Included included;
            try {
                included = inspect(entry, visitor, openDirectories);
            } catch (IOException e) {
                rethrowIfFatal(visitor.handleError(e, directory, entry));
                continue;
            }
            if (included != null) {
                add(builder, entry, included, visitor, openDirectories);
            }
        }
    }

    /**
     * Everything about an entry that can fail, done before the builder is touched so an
     * ignored error never leaves it half-updated.
     *
     * @return null when the entry is excluded
     */
    private Included inspect(Path entry, PathVisitor visitor, Deque<Object> openDirectories) throws IOException {
        String name = entry.getFileName().toString();
        if (config.isSkipHidden() && name.startsWith(".")) {
            return null;
        }
        if (!PathComponents.isValid(name, config.separatorChar())) {
            throw new IOException("File name cannot be stored as a path component: " + entry);
        }

        BasicFileAttributes attributes = Files.readAttributes(entry, BasicFileAttributes.class,
            config.isFollowLinks() ? FOLLOW : NO_FOLLOW);
        if (!visitor.filter(entry, attributes)) {
            return null;
        }

        Object key = null;
        if (attributes.isDirectory() && config.isFollowLinks()) {
            key = fileKey(entry, attributes);
            if (openDirectories.contains(key)) {
                throw new FileSystemLoopException(entry.toString());
            }
        }
        visitor.visit(entry, attributes);
        return new Included(name, attributes.isDirectory(), key);
    }

    private void add(CompactPathTreeBuilder builder, Path entry, Included included, PathVisitor visitor,
                     Deque<Object> openDirectories) throws IOException {
        if (!included.directory) {
            builder.leaf(included.name);
            return;
        }

        builder.enter(included.name);
        if (included.key != null) {
            openDirectories.push(included.key);
        }
        try {
            scanDirectory(builder, entry, visitor, openDirectories);
        } finally {
            if (included.key != null) {
                openDirectories.pop();
            }
            builder.leave();
        }
    }

    private static List<Path> listEntries(Path directory) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        entries.sort(Comparator.comparing(entry -> entry.getFileName().toString()));
        return entries;
    }

    private static Object fileKey(Path directory) throws IOException {
        return fileKey(directory, Files.readAttributes(directory, BasicFileAttributes.class));
    }

    // some file systems have no file keys; the real path stands in for them
    private static Object fileKey(Path directory, BasicFileAttributes attributes) throws IOException {
        Object key = attributes.fileKey();
        return key != null ? key : directory.toRealPath();
    }

    private static void rethrowIfFatal(Optional<IOException> fatal) throws IOException {
        if (fatal.isPresent()) {
            throw fatal.get();
        }
    }

    private static final class Included {
        final String name;
        final boolean directory;
        // file key of a followed directory, null otherwise
        final Object key;

        Included(String name, boolean directory, Object key) {
            this.name = name;
            this.directory = directory;
            this.key = key;
        }
    }
}
