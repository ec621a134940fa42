package im.arun.pathtree.error;

/**
 * A path component was empty, reserved, or contained the separator.
 * The call that supplied it is rejected and the builder stays usable.
 */
public class InvalidComponentException extends PathTreeException {
    private final String component;

    public InvalidComponentException(String component, String reason) {
        super(String.format("Invalid path component '%s': %s", component, reason));
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
