package im.arun.pathtree.error;

/**
 * Base type for every failure raised while building or replaying a compact path tree.
 */
public class PathTreeException extends RuntimeException {

    public PathTreeException(String message) {
        super(message);
    }

    public PathTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
