package cmdtree.common;

public class MissingUsageException extends CommandException {
    public MissingUsageException(final String message) {
        super(message);
    }
}
