package im.arun.pathtree.scan;

import im.arun.pathtree.config.PathTreeConfig;
import im.arun.pathtree.util.PathComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DirectoryTreeScannerTest {

    @TempDir
    Path root;

    @BeforeEach
    void createTree() throws IOException {
        Files.createDirectories(root.resolve("outer/b"));
        Files.writeString(root.resolve("outer/a"), "a");
        Files.writeString(root.resolve("outer/b/c"), "cc");
        Files.writeString(root.resolve("outer/b/d"), "ddd");
        Files.createDirectories(root.resolve("outer/e"));
        Files.writeString(root.resolve(".hidden"), "");
    }

    private static List<String> joined(ScannedTree scanned) {
        return scanned.getTree().stream()
            .map(path -> PathComponents.join(path, '/'))
            .collect(Collectors.toList());
    }

    @Test
    void scansInDepthFirstNameOrder() throws IOException {
        ScannedTree scanned = new DirectoryTreeScanner().scan(root);

        assertThat(joined(scanned)).containsExactly(
            ".hidden", "outer", "outer/a", "outer/b", "outer/b/c", "outer/b/d", "outer/e");
        assertThat(scanned.getTree().encode()).isEqualTo(".hidden/../outer/a/../b/c/../d/../../e/../..");
        assertThat(scanned.getRoot()).isEqualTo(root);
    }

    @Test
    void pathsResolveAgainstTheRoot() throws IOException {
        ScannedTree scanned = new DirectoryTreeScanner().scan(root);

        assertThat(scanned.paths()).allMatch(Files::exists);
        assertThat(scanned.paths()).contains(root.resolve("outer").resolve("b").resolve("d"));
        assertThat(scanned.itemCount()).isEqualTo(7);
    }

    @Test
    void hiddenEntriesCanBeSkipped() throws IOException {
        PathTreeConfig config = new PathTreeConfig();
        config.setSkipHidden(true);

        assertThat(joined(new DirectoryTreeScanner(config).scan(root))).doesNotContain(".hidden").hasSize(6);
    }

    @Test
    void filteredDirectoriesDropTheirSubtree() throws IOException {
        PathVisitor visitor = new PathVisitor() {
            @Override
            public boolean filter(Path entry, BasicFileAttributes attributes) {
                return !entry.getFileName().toString().equals("b");
            }
        };

        assertThat(joined(new DirectoryTreeScanner().scan(root, visitor)))
            .containsExactly(".hidden", "outer", "outer/a", "outer/e");
    }

    @Test
    void visitSeesEveryIncludedEntry() throws IOException {
        List<Path> visited = new ArrayList<>();
        PathVisitor visitor = new PathVisitor() {
            @Override
            public void visit(Path entry, BasicFileAttributes attributes) {
                visited.add(entry);
            }
        };

        ScannedTree scanned = new DirectoryTreeScanner().scan(root, visitor);
        assertThat(visited).containsExactlyElementsOf(scanned.paths().collect(Collectors.toList()));
    }

    @Test
    void ignoredErrorsLeaveTheTreeConsistent() throws IOException {
        List<Path> failed = new ArrayList<>();
        PathVisitor visitor = new PathVisitor() {
            @Override
            public boolean filter(Path entry, BasicFileAttributes attributes) throws IOException {
                if (entry.getFileName().toString().equals("c")) {
                    throw new AccessDeniedException(entry.toString());
                }
                return true;
            }

            @Override
            public Optional<IOException> handleError(IOException error, Path directory, Path entry) {
                failed.add(entry);
                return PathVisitor.super.handleError(error, directory, entry);
            }
        };

        ScannedTree scanned = new DirectoryTreeScanner().scan(root, visitor);
        assertThat(failed).containsExactly(root.resolve("outer/b/c"));
        assertThat(joined(scanned)).containsExactly(
            ".hidden", "outer", "outer/a", "outer/b", "outer/b/d", "outer/e");
    }

    @Test
    void fatalErrorsAbortTheScan() {
        PathVisitor visitor = new PathVisitor() {
            @Override
            public void visit(Path entry, BasicFileAttributes attributes) throws IOException {
                throw new IOException("boom");
            }
        };

        assertThatThrownBy(() -> new DirectoryTreeScanner().scan(root, visitor))
            .isInstanceOf(IOException.class)
            .hasMessage("boom");
    }

    @Test
    void unreadableRootIsReportedToTheVisitor() {
        Path missing = root.resolve("missing");
        assertThatThrownBy(() -> new DirectoryTreeScanner().scan(missing)).isInstanceOf(IOException.class);
    }

    @Test
    void namesContainingTheSeparatorAreErrors() throws IOException {
        PathTreeConfig config = new PathTreeConfig();
        config.setSeparator("_");
        Files.writeString(root.resolve("with_underscore"), "");

        List<Path> rejected = new ArrayList<>();
        PathVisitor visitor = new PathVisitor() {
            @Override
            public Optional<IOException> handleError(IOException error, Path directory, Path entry) {
                rejected.add(entry);
                return Optional.empty();
            }
        };

        ScannedTree scanned = new DirectoryTreeScanner(config).scan(root, visitor);
        assertThat(rejected).containsExactly(root.resolve("with_underscore"));
        assertThat(scanned.itemCount()).isEqualTo(7);
    }

    @Test
    void symlinksAreStoredButNotFollowed() throws IOException {
        Path link = root.resolve("outer/link");
        try {
            Files.createSymbolicLink(link, root.resolve("outer/b"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported: " + e.getMessage());
        }

        assertThat(joined(new DirectoryTreeScanner().scan(root)))
            .contains("outer/link")
            .doesNotContain("outer/link/c");

        PathTreeConfig config = new PathTreeConfig();
        config.setFollowLinks(true);
        assertThat(joined(new DirectoryTreeScanner(config).scan(root)))
            .contains("outer/link/c", "outer/link/d");
    }

    @Test
    void followedLinkCyclesAreLoopErrors() throws IOException {
        Path link = root.resolve("outer/b/up");
        try {
            Files.createSymbolicLink(link, root.resolve("outer"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported: " + e.getMessage());
        }
        PathTreeConfig config = new PathTreeConfig();
        config.setFollowLinks(true);

        assertThatThrownBy(() -> new DirectoryTreeScanner(config).scan(root))
            .isInstanceOf(FileSystemLoopException.class);
    }

    @Test
    void defaultErrorHandlingSkipsOnlyAccessDenied() {
        PathVisitor visitor = new PathVisitor() { };
        Path directory = root.resolve("src");

        assertThat(visitor.handleError(new AccessDeniedException("x"), directory, directory.resolve("x"))).isEmpty();
        assertThat(visitor.handleError(new AccessDeniedException("src"), directory, null)).isEmpty();
        IOException other = new IOException("disk gone");
        assertThat(visitor.handleError(other, directory, null)).containsSame(other);
    }
}
