package cmdtree.common;

public class DuplicateCommandException extends CommandException {
    public DuplicateCommandException(final String message) {
        super(message);
    }
}
