package im.arun.pathtree.error;

/**
 * A leave was requested with no open directory to close.
 */
public class UnbalancedLeaveException extends PathTreeException {

    public UnbalancedLeaveException() {
        super("leave() called with no open directory");
    }
}
