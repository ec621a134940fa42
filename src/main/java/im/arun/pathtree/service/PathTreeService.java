package im.arun.pathtree.service;

import im.arun.pathtree.config.PathTreeConfig;
import im.arun.pathtree.model.TreeSummary;
import im.arun.pathtree.scan.DirectoryTreeScanner;
import im.arun.pathtree.scan.PathVisitor;
import im.arun.pathtree.scan.ScannedTree;
import im.arun.pathtree.tree.CompactPathTree;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Iterator;
import java.util.Optional;

/**
 * Scans a directory into a compact tree and reports what it contains.
 */
public class PathTreeService {
    private static final Logger logger = LoggerFactory.getLogger(PathTreeService.class);

    private final PathTreeConfig config;
    private final DirectoryTreeScanner scanner;

    public PathTreeService(PathTreeConfig config) {
        this.config = config;
        this.scanner = new DirectoryTreeScanner(config);
    }

    public ScanResult scan(Path root) throws IOException {
        logger.info("Constructing tree from {}", root);

        StatsVisitor stats = new StatsVisitor(config.isFailOnAccessDenied());
        long start = System.nanoTime();
        ScannedTree scanned = scanner.scan(root, stats);
        long buildMillis = (System.nanoTime() - start) / 1_000_000;

        CompactPathTree tree = scanned.getTree();
        TreeSummary summary = new TreeSummary();
        summary.setRoot(root.toString());
        summary.setItems(stats.items);
        summary.setDirectories(stats.directories);
        summary.setFiles(stats.files);
        summary.setSymlinks(stats.symlinks);
        summary.setOther(stats.other);
        summary.setTotalBytes(stats.bytes);
        summary.setTokenCount(tree.tokenCount());
        summary.setAscendCount(tree.ascendCount());
        summary.setEncodedLength(tree.encode(config.separatorChar()).length());
        summary.setBuildMillis(buildMillis);

        if (stats.items != tree.itemCount()) {
            throw new IllegalStateException(String.format(
                "Visited %d items but the tree holds %d", stats.items, tree.itemCount()));
        }
        return new ScanResult(scanned, summary);
    }

    /**
     * Check that every path stored in the tree still exists, without following links.
     *
     * @return number of stored paths that are gone
     */
    public int verify(ScanResult result) {
        int missing = 0;
        Iterator<Path> paths = result.getScannedTree().paths().iterator();
        while (paths.hasNext()) {
            Path path = paths.next();
            if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
                logger.warn("Path stored in tree but missing from file system: {}", path);
                missing++;
            }
        }
        result.getSummary().setMissingPaths(missing);
        return missing;
    }

    @Getter
    @AllArgsConstructor
    public static class ScanResult {
        private final ScannedTree scannedTree;
        private final TreeSummary summary;
    }

    /**
     * Counts included entries by type.
     */
    static class StatsVisitor implements PathVisitor {
        private final boolean failOnAccessDenied;
        long items;
        long directories;
        long files;
        long symlinks;
        long other;
        long bytes;

        StatsVisitor(boolean failOnAccessDenied) {
            this.failOnAccessDenied = failOnAccessDenied;
        }

        @Override
        public void visit(Path entry, BasicFileAttributes attributes) {
            if (attributes.isRegularFile()) {
                files++;
            } else if (attributes.isDirectory()) {
                directories++;
            } else if (attributes.isSymbolicLink()) {
                symlinks++;
            } else {
                other++;
            }
            items++;
            bytes += attributes.size();
        }

        @Override
        public Optional<IOException> handleError(IOException error, Path directory, Path entry) {
            if (failOnAccessDenied && error instanceof AccessDeniedException) {
                return Optional.of(error);
            }
            return PathVisitor.super.handleError(error, directory, entry);
        }
    }
}
