package im.arun.pathtree.model;

import im.arun.pathtree.util.PathComponents;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One entry of a compact path tree: either a component name, which opens a new item,
 * or an ascend marker, which closes the most recently opened component.
 */
@Getter
@EqualsAndHashCode
public final class PathToken {

    public enum Kind {
        NAME,
        ASCEND
    }

    public static final PathToken ASCEND = new PathToken(Kind.ASCEND, null);

    private final Kind kind;

    /** Component name, null for {@link #ASCEND}. */
    private final String name;

    private PathToken(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    /**
     * Name token for a component, validated against the default separator.
     */
    public static PathToken of(String component) {
        return new PathToken(Kind.NAME, PathComponents.requireValid(component));
    }

    /**
     * Token for an already validated component, or {@link #ASCEND} when {@code component} is null.
     */
    public static PathToken fromStored(String component) {
        return component == null ? ASCEND : new PathToken(Kind.NAME, component);
    }

    public boolean isAscend() {
        return kind == Kind.ASCEND;
    }

    public boolean isName() {
        return kind == Kind.NAME;
    }

    @Override
    public String toString() {
        return isAscend() ? PathComponents.ASCEND : name;
    }
}
