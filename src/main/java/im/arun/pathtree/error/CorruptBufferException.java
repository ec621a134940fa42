package im.arun.pathtree.error;

/**
 * An ascend token was found while no component was open. Trees produced by the builder never
 * contain such a token, so this always points to a construction defect or a damaged encoding.
 */
public class CorruptBufferException extends PathTreeException {
    private final int position;

    public CorruptBufferException(int position) {
        super(String.format("Ascend at token %d would pop an empty path stack", position));
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
