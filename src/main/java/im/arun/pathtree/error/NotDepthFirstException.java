package im.arun.pathtree.error;

import java.util.List;

/**
 * A full path could not be reached from the previous item by ascending and then descending,
 * meaning the input was not a depth-first pre-order listing.
 */
public class NotDepthFirstException extends PathTreeException {
    private final int index;
    private final List<String> path;

    public NotDepthFirstException(int index, List<String> path, String reason) {
        super(String.format("Path #%d %s is not in depth-first order: %s", index, path, reason));
        this.index = index;
        this.path = path;
    }

    /**
     * Zero-based position of the rejected path in the input sequence.
     */
    public int getIndex() {
        return index;
    }

    public List<String> getPath() {
        return path;
    }
}
