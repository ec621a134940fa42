package im.arun.pathtree.scan;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * Decides which entries a {@link DirectoryTreeScanner} includes and how errors are handled,
 * or just observes entries as the tree is built.
 */
public interface PathVisitor {

    /**
     * Whether the entry should be included. Returning false also omits every child of a
     * directory. An exception omits the entry and is passed to {@link #handleError}.
     */
    default boolean filter(Path entry, BasicFileAttributes attributes) throws IOException {
        return true;
    }

    /**
     * Called for every included entry, after {@link #filter} and before it is added.
     */
    default void visit(Path entry, BasicFileAttributes attributes) throws IOException {
    }

    /**
     * Decide whether an error stops the scan. A present result is rethrown and aborts it;
     * an empty result skips the entry and carries on.
     *
     * <p>Called for every error, including those thrown by {@link #filter} and {@link #visit}.
     * The default logs access-denied errors and continues; anything else is fatal.
     *
     * @param directory the directory being listed
     * @param entry     the entry being added, or null when listing {@code directory} failed
     */
    default Optional<IOException> handleError(IOException error, Path directory, Path entry) {
        if (error instanceof AccessDeniedException) {
            DirectoryTreeScanner.visitorLogger.warn("Permission denied reading {}: {}",
                entry == null ? "item in " + directory : entry, error.getMessage());
            return Optional.empty();
        }
        return Optional.of(error);
    }
}
