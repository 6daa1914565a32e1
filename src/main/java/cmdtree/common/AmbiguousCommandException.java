package cmdtree.common;

public class AmbiguousCommandException extends CommandException {
    public AmbiguousCommandException(final String message) {
        super(message);
    }
}
